package org.readacademy.engine.domain.exception;

/**
 * A reservation found the slot full or blacked out. Recoverable: the caller moves on.
 */
public class CapacityExceededException extends SchedulingException {

    private final String slotId;

    public CapacityExceededException(String slotId) {
        super("No remaining capacity in slot " + slotId);
        this.slotId = slotId;
    }

    public String getSlotId() {
        return slotId;
    }
}
