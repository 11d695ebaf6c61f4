package com.taskpulse.checkin.integration.contract.checkin;

import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import com.taskpulse.checkin.integration.enumerations.CheckInTrigger;
import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;

import java.time.Instant;

/**
 * One scheduled request for a progress update on a task, tied to one cycle of
 * one (task, user) pair.
 *
 * <h2>Identity</h2>
 * <p>A check-in is identified by {@link #getId()} and, in business terms, by
 * {@code (taskId, userId, cycleNumber)}. Cycle numbers start at 1 and are
 * contiguous per pair.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *               ┌─────────────┐
 *        ┌──────│   PENDING   │──────┬──────────────┐
 *        │      └──────┬──────┘      │              │
 *        ▼             ▼             ▼              ▼
 *   RESPONDED       SKIPPED       EXPIRED       ESCALATED
 *        │  (friction) │             │              ▲
 *        └─────────────┴─────────────┴──────────────┘
 * </pre>
 *
 * <p>Nullable fields stay {@code null} until the transition that owns them
 * has happened. Escalation fields are set only when the status is
 * {@link CheckInStatus#ESCALATED}.</p>
 */
public interface ICheckIn {

    String getId();

    String getOrgId();

    String getTeamId();

    String getTaskId();

    String getUserId();

    int getCycleNumber();

    CheckInTrigger getTrigger();

    CheckInStatus getStatus();

    Instant getScheduledAt();

    /**
     * End of the response window, strictly after {@link #getScheduledAt()} when set.
     */
    Instant getExpiresAt();

    /**
     * When the subject responded or skipped.
     */
    Instant getRespondedAt();

    ProgressIndicator getProgressIndicator();

    String getProgressNotes();

    String getCompletedSinceLast();

    String getBlockersReported();

    boolean isHelpNeeded();

    /**
     * Change to the estimated completion, in hours. Negative means earlier.
     */
    Double getEstimatedCompletionChange();

    String getSkipReason();

    String getAiSuggestion();

    Double getAiConfidence();

    /**
     * Sentiment of the submission in {@code [0, 1]}, absent when analysis was off or unavailable.
     */
    Double getSentimentScore();

    boolean isFrictionDetected();

    boolean isEscalated();

    String getEscalatedTo();

    Instant getEscalatedAt();

    String getEscalationReason();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    /**
     * Whether the subject submitted a progress update in this cycle.
     * True for responded check-ins, including those later escalated for friction.
     */
    default boolean hasSubmission() {
        return getProgressIndicator() != null;
    }

    /**
     * Whether the check-in is still pending although its response window has closed.
     */
    default boolean isOverdue(Instant now) {
        return getStatus() == CheckInStatus.PENDING
                && getExpiresAt() != null
                && now.isAfter(getExpiresAt());
    }
}
