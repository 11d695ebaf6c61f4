package com.taskpulse.checkin.integration.models.config;

import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Check-in policy record. Defaults match a freshly created organization default.
 */
@Data
@Builder(toBuilder = true)
@With
public class CheckInConfigModel implements ICheckInConfig, Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_INTERVAL_HOURS = 3.0;
    public static final double DEFAULT_SILENT_MODE_THRESHOLD = 0.3;
    public static final int DEFAULT_MAX_DAILY_CHECKINS = 4;
    public static final int DEFAULT_WORK_START_HOUR = 9;
    public static final int DEFAULT_WORK_END_HOUR = 18;
    public static final int DEFAULT_AUTO_ESCALATE_AFTER_MISSED = 2;

    private final String id;
    private final String orgId;
    private final String teamId;
    private final String userId;
    private final String taskId;

    @Builder.Default
    private final double intervalHours = DEFAULT_INTERVAL_HOURS;

    @Builder.Default
    private final boolean enabled = true;

    @Builder.Default
    private final double silentModeThreshold = DEFAULT_SILENT_MODE_THRESHOLD;

    @Builder.Default
    private final int maxDailyCheckins = DEFAULT_MAX_DAILY_CHECKINS;

    @Builder.Default
    private final int workStartHour = DEFAULT_WORK_START_HOUR;

    @Builder.Default
    private final int workEndHour = DEFAULT_WORK_END_HOUR;

    @Builder.Default
    private final boolean respectTimezone = true;

    @Builder.Default
    private final Set<DayOfWeek> excludedDays = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    @Builder.Default
    private final int autoEscalateAfterMissed = DEFAULT_AUTO_ESCALATE_AFTER_MISSED;

    @Builder.Default
    private final boolean escalateToManager = true;

    @Builder.Default
    private final boolean aiSuggestionsEnabled = true;

    @Builder.Default
    private final boolean aiSentimentAnalysis = true;

    private final Integer responseWindowMinutes;

    private final Instant createdAt;
    private final Instant updatedAt;

    public static CheckInConfigModel organizationDefault(String orgId) {
        return CheckInConfigModel.builder().orgId(orgId).build();
    }
}
