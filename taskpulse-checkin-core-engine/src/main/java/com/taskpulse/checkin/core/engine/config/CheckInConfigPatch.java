package com.taskpulse.checkin.core.engine.config;

import com.taskpulse.checkin.core.exception.CheckInValidationException;
import com.taskpulse.checkin.integration.models.config.CheckInConfigModel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

/**
 * Partial update of a config record; {@code null} leaves a field unchanged.
 * A custom response window is cleared back to the engine default with
 * {@code resetResponseWindow}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckInConfigPatch {

    private Double intervalHours;
    private Boolean enabled;
    private Double silentModeThreshold;
    private Integer maxDailyCheckins;
    private Integer workStartHour;
    private Integer workEndHour;
    private Boolean respectTimezone;
    private Set<DayOfWeek> excludedDays;
    private Integer autoEscalateAfterMissed;
    private Boolean escalateToManager;
    private Boolean aiSuggestionsEnabled;
    private Boolean aiSentimentAnalysis;
    private Integer responseWindowMinutes;
    private boolean resetResponseWindow;

    public CheckInConfigModel applyTo(CheckInConfigModel current) {
        CheckInConfigModel.CheckInConfigModelBuilder builder = current.toBuilder();
        if (intervalHours != null) builder.intervalHours(intervalHours);
        if (enabled != null) builder.enabled(enabled);
        if (silentModeThreshold != null) builder.silentModeThreshold(silentModeThreshold);
        if (maxDailyCheckins != null) builder.maxDailyCheckins(maxDailyCheckins);
        if (workStartHour != null) builder.workStartHour(workStartHour);
        if (workEndHour != null) builder.workEndHour(workEndHour);
        if (respectTimezone != null) builder.respectTimezone(respectTimezone);
        if (excludedDays != null) builder.excludedDays(excludedDays.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(excludedDays));
        if (autoEscalateAfterMissed != null) builder.autoEscalateAfterMissed(autoEscalateAfterMissed);
        if (escalateToManager != null) builder.escalateToManager(escalateToManager);
        if (aiSuggestionsEnabled != null) builder.aiSuggestionsEnabled(aiSuggestionsEnabled);
        if (aiSentimentAnalysis != null) builder.aiSentimentAnalysis(aiSentimentAnalysis);
        if (resetResponseWindow) {
            if (responseWindowMinutes != null) {
                throw new CheckInValidationException("response_window_minutes", "cannot be combined with reset_response_window");
            }
            builder.responseWindowMinutes(null);
        } else if (responseWindowMinutes != null) {
            builder.responseWindowMinutes(responseWindowMinutes);
        }
        return builder.build();
    }
}
