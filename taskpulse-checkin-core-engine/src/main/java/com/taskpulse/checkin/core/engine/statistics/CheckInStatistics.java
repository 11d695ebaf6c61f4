package com.taskpulse.checkin.core.engine.statistics;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Response metrics over the check-ins scheduled within a period.
 * Rates are percentages; {@code responseRate} is {@code responded / total * 100}, 0 without check-ins.
 */
@Data
@Builder
public class CheckInStatistics {
    private final String orgId;
    private final String teamId;
    private final String userId;
    private final int periodDays;
    private final Instant periodStart;

    private final long total;
    private final long pending;
    private final long responded;
    private final long skipped;
    private final long expired;
    private final long escalated;

    private final double responseRate;
    private final Double averageResponseTimeMinutes;
    private final long frictionCount;
    private final double frictionRate;
    private final long helpRequestedCount;
    private final double helpRequestedRate;
}
