package org.readacademy.engine.domain.exception;

/**
 * A slot identifier that the calendar never registered.
 */
public class UnknownSlotException extends SchedulingException {

    private final String slotId;

    public UnknownSlotException(String slotId) {
        super("Unknown slot: " + slotId);
        this.slotId = slotId;
    }

    public String getSlotId() {
        return slotId;
    }
}
