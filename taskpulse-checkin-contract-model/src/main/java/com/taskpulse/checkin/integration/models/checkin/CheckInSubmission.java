package com.taskpulse.checkin.integration.models.checkin;

import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress update submitted by the subject when responding to a check-in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckInSubmission {

    /**
     * Required.
     */
    private ProgressIndicator progressIndicator;

    private String progressNotes;

    private String completedSinceLast;

    private String blockersReported;

    private boolean helpNeeded;

    private Double estimatedCompletionChange;

    public boolean hasBlockers() {
        return blockersReported != null && !blockersReported.isBlank();
    }

    /**
     * Friction the subject reports directly: blocker text, a help request or a
     * {@link ProgressIndicator#BLOCKED} indicator. Sentiment may add friction later.
     */
    public boolean signalsFriction() {
        return hasBlockers() || helpNeeded || progressIndicator == ProgressIndicator.BLOCKED;
    }

    /**
     * Free text fed to sentiment analysis: notes, completed work and blockers joined.
     */
    public String toAnalysisText() {
        StringBuilder text = new StringBuilder();
        append(text, progressNotes);
        append(text, completedSinceLast);
        append(text, blockersReported);
        return text.toString();
    }

    private static void append(StringBuilder text, String part) {
        if (part == null || part.isBlank()) {
            return;
        }
        if (text.length() > 0) {
            text.append('\n');
        }
        text.append(part.trim());
    }
}
