package org.readacademy.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Slot definition as stored in the schedule backend or the calendar file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SlotDto {

    @JsonProperty("slot_id")
    private String slotId;

    @JsonProperty("start")
    private String start;

    @JsonProperty("end")
    private String end;

    @JsonProperty("capacity")
    private Integer capacity;

    @JsonProperty("blackout")
    private Boolean blackout;

    public String getSlotId() {
        return slotId;
    }

    public void setSlotId(String slotId) {
        this.slotId = slotId;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Boolean getBlackout() {
        return blackout;
    }

    public void setBlackout(Boolean blackout) {
        this.blackout = blackout;
    }
}
