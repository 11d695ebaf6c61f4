package com.taskpulse.checkin.integration.contract.config;

import com.taskpulse.checkin.integration.enumerations.CheckInConfigScope;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;

/**
 * Check-in policy for exactly one scope: an organization default, a team,
 * a user or a single task. The most specific record that exists wins as a whole;
 * fields are never merged across scopes.
 */
public interface ICheckInConfig {

    String getId();

    String getOrgId();

    String getTeamId();

    String getUserId();

    String getTaskId();

    /**
     * Minimum gap between two scheduled check-ins of the same pair, at least one hour.
     */
    double getIntervalHours();

    boolean isEnabled();

    /**
     * Sentiment cutoff in {@code [0, 1]}; a score strictly below it counts as friction.
     */
    double getSilentModeThreshold();

    int getMaxDailyCheckins();

    int getWorkStartHour();

    int getWorkEndHour();

    /**
     * When true, work hours are evaluated in the subject's zone, otherwise in the engine default zone.
     */
    boolean isRespectTimezone();

    Set<DayOfWeek> getExcludedDays();

    int getAutoEscalateAfterMissed();

    boolean isEscalateToManager();

    boolean isAiSuggestionsEnabled();

    boolean isAiSentimentAnalysis();

    /**
     * Grace window in minutes before a pending check-in expires. {@code null} means the engine default.
     */
    Integer getResponseWindowMinutes();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    default CheckInConfigScope getScope() {
        if (getTaskId() != null) {
            return CheckInConfigScope.TASK;
        }
        if (getUserId() != null) {
            return CheckInConfigScope.USER;
        }
        if (getTeamId() != null) {
            return CheckInConfigScope.TEAM;
        }
        return CheckInConfigScope.ORGANIZATION;
    }

    default boolean isEligibleDay(DayOfWeek day) {
        return getExcludedDays() == null || !getExcludedDays().contains(day);
    }
}
