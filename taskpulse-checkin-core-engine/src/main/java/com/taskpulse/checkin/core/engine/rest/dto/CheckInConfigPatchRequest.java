package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpulse.checkin.core.engine.config.CheckInConfigPatch;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.Set;

/**
 * Policy fields of a config record. Absent fields are left unchanged on update
 * and take their defaults on create.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckInConfigPatchRequest {

    @DecimalMin(value = "1.0", message = "must be at least 1")
    private Double intervalHours;

    private Boolean enabled;

    @DecimalMin(value = "0.0", message = "must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "must be between 0 and 1")
    private Double silentModeThreshold;

    @Min(value = 1, message = "must be at least 1")
    private Integer maxDailyCheckins;

    @Min(value = 0, message = "must be between 0 and 23")
    @Max(value = 23, message = "must be between 0 and 23")
    private Integer workStartHour;

    @Min(value = 1, message = "must be between 1 and 24")
    @Max(value = 24, message = "must be between 1 and 24")
    private Integer workEndHour;

    private Boolean respectTimezone;

    private Set<DayOfWeek> excludedDays;

    @Min(value = 1, message = "must be at least 1")
    private Integer autoEscalateAfterMissed;

    private Boolean escalateToManager;

    private Boolean aiSuggestionsEnabled;

    private Boolean aiSentimentAnalysis;

    @Min(value = 1, message = "must be at least 1")
    private Integer responseWindowMinutes;

    /**
     * Drops a custom response window so the engine default applies again. Read on update only.
     */
    private Boolean resetResponseWindow;

    public CheckInConfigPatch toPatch() {
        return CheckInConfigPatch.builder()
                .intervalHours(intervalHours)
                .enabled(enabled)
                .silentModeThreshold(silentModeThreshold)
                .maxDailyCheckins(maxDailyCheckins)
                .workStartHour(workStartHour)
                .workEndHour(workEndHour)
                .respectTimezone(respectTimezone)
                .excludedDays(excludedDays)
                .autoEscalateAfterMissed(autoEscalateAfterMissed)
                .escalateToManager(escalateToManager)
                .aiSuggestionsEnabled(aiSuggestionsEnabled)
                .aiSentimentAnalysis(aiSentimentAnalysis)
                .responseWindowMinutes(responseWindowMinutes)
                .resetResponseWindow(Boolean.TRUE.equals(resetResponseWindow))
                .build();
    }
}
