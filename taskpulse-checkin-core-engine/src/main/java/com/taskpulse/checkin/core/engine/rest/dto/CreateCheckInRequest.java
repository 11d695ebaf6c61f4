package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpulse.checkin.integration.enumerations.CheckInTrigger;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateCheckInRequest {

    @NotBlank(message = "is required")
    private String taskId;

    /**
     * Defaults to the task's assignee.
     */
    private String userId;

    /**
     * Defaults to {@code manual}.
     */
    private CheckInTrigger trigger;
}
