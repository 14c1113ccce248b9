package org.readacademy.engine.api;

import org.readacademy.engine.api.dto.AssignmentDto;
import org.readacademy.engine.api.dto.CommitBatchDto;
import org.readacademy.engine.api.dto.ConsultationRequestDto;
import org.readacademy.engine.api.dto.DecisionDto;
import org.readacademy.engine.api.dto.SlotDemandDto;
import org.readacademy.engine.api.dto.SlotDto;
import org.readacademy.engine.api.dto.WaitlistEntryDto;
import org.readacademy.engine.domain.exception.InvalidRequestException;
import org.readacademy.engine.domain.model.AllocationDecision;
import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.model.RequestStatus;
import org.readacademy.engine.domain.model.SlotDemand;
import org.readacademy.engine.domain.model.TimeSlot;
import org.readacademy.engine.domain.model.TimeWindow;
import org.readacademy.engine.domain.model.WaitlistEntry;
import org.readacademy.engine.store.ScheduleBatch;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts between wire DTOs and the typed domain model.
 * Inbound records must be complete; anything partial is rejected here so the
 * engine never sees a half-populated request.
 */
public final class RequestMapper {

    /**
     * Grade as typed on the paper form: "3", "초3", "초3학년", "G3".
     */
    private static final Pattern GRADE = Pattern.compile("^(?:초|G|GRADE)?\\s*([1-6])\\s*(?:학년)?$");

    private RequestMapper() {
    }

    public static ConsultationRequest toRequest(ConsultationRequestDto dto) {
        if (dto == null) {
            throw new InvalidRequestException("Request record is missing");
        }
        String id = required(dto.getRequestId(), "request_id", "?");
        try {
            return new ConsultationRequest.Builder()
                    .requestId(id)
                    .guardianId(required(dto.getGuardianId(), "guardian_id", id))
                    .studentId(required(dto.getStudentId(), "student_id", id))
                    .desiredSlotIds(dto.getDesiredSlots() != null ? dto.getDesiredSlots() : new ArrayList<>())
                    .submittedAt(parseInstant(required(dto.getSubmittedAt(), "submitted_at", id), "submitted_at", id))
                    .gradeLevel(parseGrade(required(dto.getGrade(), "grade", id), id))
                    .siblingEnrolled(requiredFlag(dto.getSiblingEnrolled(), "sibling_enrolled", id))
                    .distanceTier(requiredInt(dto.getDistanceTier(), "distance_tier", id))
                    .applicationComplete(requiredFlag(dto.getApplicationComplete(), "application_complete", id))
                    .status(parseStatus(dto.getStatus(), id))
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidRequestException("Invalid request " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Maps each record, dropping and reporting invalid ones individually.
     */
    public static List<ConsultationRequest> toRequests(List<ConsultationRequestDto> dtos, List<String> rejected) {
        List<ConsultationRequest> result = new ArrayList<>();
        if (dtos == null) {
            return result;
        }
        for (ConsultationRequestDto dto : dtos) {
            try {
                result.add(toRequest(dto));
            } catch (InvalidRequestException e) {
                rejected.add(e.getMessage());
            }
        }
        return result;
    }

    public static TimeSlot toSlot(SlotDto dto) {
        if (dto == null) {
            throw new IllegalArgumentException("Slot record is missing");
        }
        String id = dto.getSlotId();
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Slot record without slot_id");
        }
        if (dto.getCapacity() == null) {
            throw new IllegalArgumentException("Slot " + id + " has no capacity");
        }
        return new TimeSlot.Builder()
                .slotId(id.trim())
                .window(new TimeWindow(parseLocal(dto.getStart(), "start", id), parseLocal(dto.getEnd(), "end", id)))
                .capacity(dto.getCapacity())
                .blackout(Boolean.TRUE.equals(dto.getBlackout()))
                .build();
    }

    public static int parseGrade(String raw, String requestId) {
        Matcher m = GRADE.matcher(raw.trim().toUpperCase(Locale.ROOT));
        if (!m.matches()) {
            throw new InvalidRequestException("Invalid grade for request " + requestId + ": " + raw);
        }
        return Integer.parseInt(m.group(1));
    }

    public static ConsultationRequestDto toDto(ConsultationRequest request) {
        ConsultationRequestDto dto = new ConsultationRequestDto();
        dto.setRequestId(request.getRequestId());
        dto.setGuardianId(request.getGuardianId());
        dto.setStudentId(request.getStudentId());
        dto.setDesiredSlots(new ArrayList<>(request.getDesiredSlotIds()));
        dto.setSubmittedAt(request.getSubmittedAt().toString());
        dto.setGrade(String.valueOf(request.getGradeLevel()));
        dto.setSiblingEnrolled(request.isSiblingEnrolled());
        dto.setDistanceTier(request.getDistanceTier());
        dto.setApplicationComplete(request.isApplicationComplete());
        dto.setStatus(request.getStatus().code());
        return dto;
    }

    public static DecisionDto toDto(AllocationDecision decision) {
        DecisionDto dto = new DecisionDto();
        dto.setRequestId(decision.getRequestId());
        dto.setStatus(decision.getStatus().code());
        dto.setSlotId(decision.getSlotId());
        dto.setReasonCode(decision.getReasonCode());
        dto.setAssignmentId(decision.getAssignmentId());
        return dto;
    }

    public static AssignmentDto toDto(Assignment assignment) {
        AssignmentDto dto = new AssignmentDto();
        dto.setAssignmentId(assignment.getAssignmentId());
        dto.setRequestId(assignment.getRequestId());
        dto.setGuardianId(assignment.getGuardianId());
        dto.setSlotId(assignment.getSlotId());
        dto.setStart(assignment.getWindow().getStart().toString());
        dto.setEnd(assignment.getWindow().getEnd().toString());
        dto.setDecidedAt(assignment.getDecidedAt().toString());
        dto.setReasonCode(assignment.getReasonCode());
        dto.setCancelledAt(assignment.getCancelledAt() != null ? assignment.getCancelledAt().toString() : null);
        return dto;
    }

    public static WaitlistEntryDto toDto(WaitlistEntry entry, int position) {
        WaitlistEntryDto dto = new WaitlistEntryDto();
        dto.setRequestId(entry.getRequestId());
        dto.setSlotId(entry.getSlotId());
        dto.setReasonCode(entry.getReason().getCode());
        dto.setListedAt(entry.getListedAt().toString());
        dto.setPosition(position);
        return dto;
    }

    public static SlotDemandDto toDto(SlotDemand demand) {
        SlotDemandDto dto = new SlotDemandDto();
        dto.setSlotId(demand.getSlotId());
        dto.setStart(demand.getWindow().getStart().toString());
        dto.setEnd(demand.getWindow().getEnd().toString());
        dto.setApplicantCount(demand.getApplicantCount());
        dto.setFirstPreferenceCount(demand.getFirstPreferenceCount());
        dto.setRemainingCapacity(demand.getRemainingCapacity());
        dto.setHighlighted(demand.isHighlighted());
        dto.setRankedRequestIds(demand.getRankedRequestIds());
        return dto;
    }

    /**
     * Waitlist entries keep their 1-based position within the slot they wait for.
     */
    public static List<WaitlistEntryDto> toWaitlistDtos(List<WaitlistEntry> entries) {
        List<WaitlistEntryDto> result = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            result.add(toDto(entries.get(i), i + 1));
        }
        return result;
    }

    public static CommitBatchDto toDto(ScheduleBatch batch) {
        CommitBatchDto dto = new CommitBatchDto();
        dto.setDecisions(batch.getDecisions().stream().map(RequestMapper::toDto).collect(Collectors.toList()));
        dto.setAssignments(batch.getAssignments().stream().map(RequestMapper::toDto).collect(Collectors.toList()));
        dto.setCancellations(batch.getCancellations().stream().map(RequestMapper::toDto).collect(Collectors.toList()));
        List<WaitlistEntryDto> waitlist = new ArrayList<>();
        for (WaitlistEntry entry : batch.getWaitlisted()) {
            waitlist.add(toDto(entry, 0));
        }
        dto.setWaitlist(waitlist);
        return dto;
    }

    private static String required(String value, String field, String requestId) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidRequestException("Request " + requestId + " is missing " + field);
        }
        return value.trim();
    }

    private static boolean requiredFlag(Boolean value, String field, String requestId) {
        if (value == null) {
            throw new InvalidRequestException("Request " + requestId + " is missing " + field);
        }
        return value;
    }

    private static int requiredInt(Integer value, String field, String requestId) {
        if (value == null) {
            throw new InvalidRequestException("Request " + requestId + " is missing " + field);
        }
        return value;
    }

    private static RequestStatus parseStatus(String raw, String requestId) {
        if (raw == null || raw.trim().isEmpty()) {
            return RequestStatus.PENDING;
        }
        try {
            return RequestStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown status for request " + requestId + ": " + raw, e);
        }
    }

    private static Instant parseInstant(String raw, String field, String requestId) {
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Invalid " + field + " for request " + requestId + ": " + raw, e);
        }
    }

    private static LocalDateTime parseLocal(String raw, String field, String slotId) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("Slot " + slotId + " is missing " + field);
        }
        try {
            return LocalDateTime.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + field + " for slot " + slotId + ": " + raw, e);
        }
    }
}
