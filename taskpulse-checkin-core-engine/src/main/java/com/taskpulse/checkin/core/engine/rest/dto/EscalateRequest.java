package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
public class EscalateRequest {

    @NotBlank(message = "is required")
    private String reason;

    /**
     * Explicit target. Without one the subject's manager is used when the config allows it.
     */
    private String escalateTo;
}
