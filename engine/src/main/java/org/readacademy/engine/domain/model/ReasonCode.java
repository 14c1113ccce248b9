package org.readacademy.engine.domain.model;

/**
 * Reason attached to every allocation decision, shown to staff as-is.
 */
public enum ReasonCode {
    MATCHED_PREFERENCE("matched-preference"),
    PROMOTED("promoted-from-waitlist"),
    MANUAL_OVERRIDE("manual-override"),
    NO_CAPACITY("no-capacity"),
    ALL_CONFLICTS("all-conflicts"),
    ALL_BLACKOUT("all-blackout"),
    NO_PREFERENCES("no-preferences"),
    UNKNOWN_SLOT("unknown-slot"),
    CANCELLED("cancelled"),
    CYCLE_CLOSED("cycle-closed");

    private final String code;

    ReasonCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Renders the code, appending the 1-based preference rank for matched preferences
     * ({@code matched-preference-2}).
     */
    public String render(int preferenceRank) {
        if (this == MATCHED_PREFERENCE) {
            return code + "-" + preferenceRank;
        }
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
