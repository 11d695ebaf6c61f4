package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;
import com.taskpulse.checkin.integration.models.checkin.CheckInSubmission;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress update for a pending check-in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RespondRequest {

    @NotNull(message = "is required")
    private ProgressIndicator progressIndicator;

    @Size(max = 4000, message = "must be at most 4000 characters")
    private String progressNotes;

    @Size(max = 4000, message = "must be at most 4000 characters")
    private String completedSinceLast;

    @Size(max = 4000, message = "must be at most 4000 characters")
    private String blockersReported;

    private Boolean helpNeeded;

    private Double estimatedCompletionChange;

    public CheckInSubmission toSubmission() {
        return CheckInSubmission.builder()
                .progressIndicator(progressIndicator)
                .progressNotes(progressNotes)
                .completedSinceLast(completedSinceLast)
                .blockersReported(blockersReported)
                .helpNeeded(Boolean.TRUE.equals(helpNeeded))
                .estimatedCompletionChange(estimatedCompletionChange)
                .build();
    }
}
