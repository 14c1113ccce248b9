package org.readacademy.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for POST v1/schedule/commits.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CommitBatchDto {

    @JsonProperty("decisions")
    private List<DecisionDto> decisions;

    @JsonProperty("assignments")
    private List<AssignmentDto> assignments;

    @JsonProperty("cancellations")
    private List<AssignmentDto> cancellations;

    @JsonProperty("waitlist")
    private List<WaitlistEntryDto> waitlist;

    public List<DecisionDto> getDecisions() {
        return decisions;
    }

    public void setDecisions(List<DecisionDto> decisions) {
        this.decisions = decisions;
    }

    public List<AssignmentDto> getAssignments() {
        return assignments;
    }

    public void setAssignments(List<AssignmentDto> assignments) {
        this.assignments = assignments;
    }

    public List<AssignmentDto> getCancellations() {
        return cancellations;
    }

    public void setCancellations(List<AssignmentDto> cancellations) {
        this.cancellations = cancellations;
    }

    public List<WaitlistEntryDto> getWaitlist() {
        return waitlist;
    }

    public void setWaitlist(List<WaitlistEntryDto> waitlist) {
        this.waitlist = waitlist;
    }
}
