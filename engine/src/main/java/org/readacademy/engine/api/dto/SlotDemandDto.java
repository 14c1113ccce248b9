package org.readacademy.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Demand line of the slot demand report.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SlotDemandDto {

    @JsonProperty("slot_id")
    private String slotId;

    @JsonProperty("start")
    private String start;

    @JsonProperty("end")
    private String end;

    @JsonProperty("applicant_count")
    private int applicantCount;

    @JsonProperty("first_preference_count")
    private int firstPreferenceCount;

    @JsonProperty("remaining_capacity")
    private int remainingCapacity;

    @JsonProperty("highlighted")
    private boolean highlighted;

    @JsonProperty("ranked_request_ids")
    private List<String> rankedRequestIds;

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

    public int getApplicantCount() {
        return applicantCount;
    }

    public void setApplicantCount(int applicantCount) {
        this.applicantCount = applicantCount;
    }

    public int getFirstPreferenceCount() {
        return firstPreferenceCount;
    }

    public void setFirstPreferenceCount(int firstPreferenceCount) {
        this.firstPreferenceCount = firstPreferenceCount;
    }

    public int getRemainingCapacity() {
        return remainingCapacity;
    }

    public void setRemainingCapacity(int remainingCapacity) {
        this.remainingCapacity = remainingCapacity;
    }

    public boolean isHighlighted() {
        return highlighted;
    }

    public void setHighlighted(boolean highlighted) {
        this.highlighted = highlighted;
    }

    public List<String> getRankedRequestIds() {
        return rankedRequestIds;
    }

    public void setRankedRequestIds(List<String> rankedRequestIds) {
        this.rankedRequestIds = rankedRequestIds;
    }
}
