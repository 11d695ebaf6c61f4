package com.taskpulse.checkin.integration.models.checkin;

import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import com.taskpulse.checkin.integration.enumerations.CheckInTrigger;
import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable value of a check-in. Transitions produce a modified copy through
 * {@code toBuilder()} and the store swaps it in atomically.
 */
@Data
@Builder(toBuilder = true)
@With
public class CheckInModel implements ICheckIn, Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String orgId;
    private final String teamId;
    private final String taskId;
    private final String userId;
    private final int cycleNumber;

    @Builder.Default
    private final CheckInTrigger trigger = CheckInTrigger.SCHEDULED;

    @Builder.Default
    private final CheckInStatus status = CheckInStatus.PENDING;

    private final Instant scheduledAt;
    private final Instant expiresAt;
    private final Instant respondedAt;

    // submission
    private final ProgressIndicator progressIndicator;
    private final String progressNotes;
    private final String completedSinceLast;
    private final String blockersReported;
    private final boolean helpNeeded;
    private final Double estimatedCompletionChange;
    private final String skipReason;

    // enrichment
    private final String aiSuggestion;
    private final Double aiConfidence;
    private final Double sentimentScore;
    private final boolean frictionDetected;

    // escalation
    private final boolean escalated;
    private final String escalatedTo;
    private final Instant escalatedAt;
    private final String escalationReason;

    private final Instant createdAt;
    private final Instant updatedAt;

    public static CheckInModel from(ICheckIn checkIn) {
        if (checkIn instanceof CheckInModel) {
            return (CheckInModel) checkIn;
        }
        return CheckInModel.builder()
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
