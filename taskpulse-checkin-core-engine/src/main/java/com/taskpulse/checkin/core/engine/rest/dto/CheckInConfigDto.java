package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.enumerations.CheckInConfigScope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckInConfigDto {

    private String id;
    private String orgId;
    private String teamId;
    private String userId;
    private String taskId;
    private CheckInConfigScope scope;
    private double intervalHours;
    private boolean enabled;
    private double silentModeThreshold;
    private int maxDailyCheckins;
    private int workStartHour;
    private int workEndHour;
    private boolean respectTimezone;
    private Set<DayOfWeek> excludedDays;
    private int autoEscalateAfterMissed;
    private boolean escalateToManager;
    private boolean aiSuggestionsEnabled;
    private boolean aiSentimentAnalysis;
    private Integer responseWindowMinutes;
    private Instant createdAt;
    private Instant updatedAt;

    public static CheckInConfigDto fromEntity(ICheckInConfig config) {
        if (config == null) {
            return null;
        }

        return CheckInConfigDto.builder()
                .id(config.getId())
                .orgId(config.getOrgId())
                .teamId(config.getTeamId())
                .userId(config.getUserId())
                .taskId(config.getTaskId())
                .scope(config.getScope())
                .intervalHours(config.getIntervalHours())
                .enabled(config.isEnabled())
                .silentModeThreshold(config.getSilentModeThreshold())
                .maxDailyCheckins(config.getMaxDailyCheckins())
                .workStartHour(config.getWorkStartHour())
                .workEndHour(config.getWorkEndHour())
                .respectTimezone(config.isRespectTimezone())
                .excludedDays(config.getExcludedDays() != null ? new TreeSet<>(config.getExcludedDays()) : Set.of())
                .autoEscalateAfterMissed(config.getAutoEscalateAfterMissed())
                .escalateToManager(config.isEscalateToManager())
                .aiSuggestionsEnabled(config.isAiSuggestionsEnabled())
                .aiSentimentAnalysis(config.isAiSentimentAnalysis())
                .responseWindowMinutes(config.getResponseWindowMinutes())
                .createdAt(config.getCreatedAt())
                .updatedAt(config.getUpdatedAt())
                .build();
    }
}
