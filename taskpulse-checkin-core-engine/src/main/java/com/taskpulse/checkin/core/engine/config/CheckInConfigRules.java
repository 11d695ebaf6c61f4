package com.taskpulse.checkin.core.engine.config;

import com.taskpulse.checkin.core.exception.CheckInValidationException;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;

import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field and cross-field rules of a config record.
 */
public final class CheckInConfigRules {

    private CheckInConfigRules() {
    }

    public static void validate(ICheckInConfig config) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (isBlank(config.getOrgId())) {
            errors.put("org_id", "is required");
        }
        int scopeIds = (config.getTeamId() != null ? 1 : 0)
                + (config.getUserId() != null ? 1 : 0)
                + (config.getTaskId() != null ? 1 : 0);
        if (scopeIds > 1) {
            errors.put("scope", "at most one of team_id, user_id, task_id may be set");
        }
        if (config.getIntervalHours() < 1) {
            errors.put("interval_hours", "must be at least 1");
        }
        if (config.getSilentModeThreshold() < 0 || config.getSilentModeThreshold() > 1) {
            errors.put("silent_mode_threshold", "must be between 0 and 1");
        }
        if (config.getMaxDailyCheckins() < 1) {
            errors.put("max_daily_checkins", "must be at least 1");
        }
        if (config.getWorkStartHour() < 0 || config.getWorkStartHour() > 23) {
            errors.put("work_start_hour", "must be between 0 and 23");
        }
        if (config.getWorkEndHour() < 1 || config.getWorkEndHour() > 24) {
            errors.put("work_end_hour", "must be between 1 and 24");
        } else if (config.getWorkStartHour() >= config.getWorkEndHour()) {
            errors.put("work_end_hour", "must be after work_start_hour");
        }
        if (config.getExcludedDays() != null && config.getExcludedDays().size() >= DayOfWeek.values().length) {
            errors.put("excluded_days", "must leave at least one day eligible");
        }
        if (config.getAutoEscalateAfterMissed() < 1) {
            errors.put("auto_escalate_after_missed", "must be at least 1");
        }
        if (config.getResponseWindowMinutes() != null && config.getResponseWindowMinutes() < 1) {
            errors.put("response_window_minutes", "must be at least 1");
        }

        if (!errors.isEmpty()) {
            throw new CheckInValidationException(errors);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
