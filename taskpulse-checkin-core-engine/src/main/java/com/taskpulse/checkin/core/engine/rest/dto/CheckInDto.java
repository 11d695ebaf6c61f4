package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import com.taskpulse.checkin.integration.enumerations.CheckInTrigger;
import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Check-in as returned by the API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckInDto {

    private String id;
    private String orgId;
    private String teamId;
    private String taskId;
    private String userId;
    private int cycleNumber;
    private CheckInTrigger trigger;
    private CheckInStatus status;
    private Instant scheduledAt;
    private Instant expiresAt;
    private Instant respondedAt;
    private ProgressIndicator progressIndicator;
    private String progressNotes;
    private String completedSinceLast;
    private String blockersReported;
    private boolean helpNeeded;
    private Double estimatedCompletionChange;
    private String skipReason;
    private String aiSuggestion;
    private Double aiConfidence;
    private Double sentimentScore;
    private boolean frictionDetected;
    private boolean escalated;
    private String escalatedTo;
    private Instant escalatedAt;
    private String escalationReason;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Number of recorded transitions; only filled on single check-in reads.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Long transitionCount;

    public static CheckInDto fromEntity(ICheckIn checkIn) {
        if (checkIn == null) {
            return null;
        }

        return CheckInDto.builder()
                .id(checkIn.getId())
                .orgId(checkIn.getOrgId())
                .teamId(checkIn.getTeamId())
                .taskId(checkIn.getTaskId())
                .userId(checkIn.getUserId())
                .cycleNumber(checkIn.getCycleNumber())
                .trigger(checkIn.getTrigger())
                .status(checkIn.getStatus())
                .scheduledAt(checkIn.getScheduledAt())
                .expiresAt(checkIn.getExpiresAt())
                .respondedAt(checkIn.getRespondedAt())
                .progressIndicator(checkIn.getProgressIndicator())
                .progressNotes(checkIn.getProgressNotes())
                .completedSinceLast(checkIn.getCompletedSinceLast())
                .blockersReported(checkIn.getBlockersReported())
                .helpNeeded(checkIn.isHelpNeeded())
                .estimatedCompletionChange(checkIn.getEstimatedCompletionChange())
                .skipReason(checkIn.getSkipReason())
                .aiSuggestion(checkIn.getAiSuggestion())
                .aiConfidence(checkIn.getAiConfidence())
                .sentimentScore(checkIn.getSentimentScore())
                .frictionDetected(checkIn.isFrictionDetected())
                .escalated(checkIn.isEscalated())
                .escalatedTo(checkIn.getEscalatedTo())
                .escalatedAt(checkIn.getEscalatedAt())
                .escalationReason(checkIn.getEscalationReason())
                .createdAt(checkIn.getCreatedAt())
                .updatedAt(checkIn.getUpdatedAt())
                .build();
    }
}
