package org.readacademy.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wait-list position of one request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WaitlistEntryDto {

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("slot_id")
    private String slotId;

    @JsonProperty("reason_code")
    private String reasonCode;

    @JsonProperty("listed_at")
    private String listedAt;

    @JsonProperty("position")
    private int position;

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getSlotId() {
        return slotId;
    }

    public void setSlotId(String slotId) {
        this.slotId = slotId;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public void setReasonCode(String reasonCode) {
        this.reasonCode = reasonCode;
    }

    public String getListedAt() {
        return listedAt;
    }

    public void setListedAt(String listedAt) {
        this.listedAt = listedAt;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }
}
