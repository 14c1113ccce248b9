package org.readacademy.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Consultation request as delivered by the intake pipeline. Loosely typed; see RequestMapper.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ConsultationRequestDto {

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("guardian_id")
    private String guardianId;

    @JsonProperty("student_id")
    private String studentId;

    @JsonProperty("desired_slots")
    private List<String> desiredSlots;

    @JsonProperty("submitted_at")
    private String submittedAt;

    @JsonProperty("grade")
    private String grade;

    @JsonProperty("sibling_enrolled")
    private Boolean siblingEnrolled;

    @JsonProperty("distance_tier")
    private Integer distanceTier;

    @JsonProperty("application_complete")
    private Boolean applicationComplete;

    @JsonProperty("status")
    private String status;

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getGuardianId() {
        return guardianId;
    }

    public void setGuardianId(String guardianId) {
        this.guardianId = guardianId;
    }

    public String getStudentId() {
        return studentId;
    }

    public void setStudentId(String studentId) {
        this.studentId = studentId;
    }

    public List<String> getDesiredSlots() {
        return desiredSlots;
    }

    public void setDesiredSlots(List<String> desiredSlots) {
        this.desiredSlots = desiredSlots;
    }

    public String getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(String submittedAt) {
        this.submittedAt = submittedAt;
    }

    public String getGrade() {
        return grade;
    }

    public void setGrade(String grade) {
        this.grade = grade;
    }

    public Boolean getSiblingEnrolled() {
        return siblingEnrolled;
    }

    public void setSiblingEnrolled(Boolean siblingEnrolled) {
        this.siblingEnrolled = siblingEnrolled;
    }

    public Integer getDistanceTier() {
        return distanceTier;
    }

    public void setDistanceTier(Integer distanceTier) {
        this.distanceTier = distanceTier;
    }

    public Boolean getApplicationComplete() {
        return applicationComplete;
    }

    public void setApplicationComplete(Boolean applicationComplete) {
        this.applicationComplete = applicationComplete;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
