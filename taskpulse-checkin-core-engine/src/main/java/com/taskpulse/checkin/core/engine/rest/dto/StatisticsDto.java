package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taskpulse.checkin.core.engine.statistics.CheckInStatistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StatisticsDto {

    private String orgId;
    private String teamId;
    private String userId;
    private int periodDays;
    private Instant periodStart;
    private long totalCheckins;
    private long pending;
    private long responded;
    private long skipped;
    private long expired;
    private long escalated;
    private double responseRate;
    private Double averageResponseTimeMinutes;
    private long frictionCount;
    private double frictionRate;
    private long helpRequestedCount;
    private double helpRequestedRate;

    public static StatisticsDto from(CheckInStatistics statistics) {
        return StatisticsDto.builder()
                .orgId(statistics.getOrgId())
                .teamId(statistics.getTeamId())
                .userId(statistics.getUserId())
                .periodDays(statistics.getPeriodDays())
                .periodStart(statistics.getPeriodStart())
                .totalCheckins(statistics.getTotal())
                .pending(statistics.getPending())
                .responded(statistics.getResponded())
                .skipped(statistics.getSkipped())
                .expired(statistics.getExpired())
                .escalated(statistics.getEscalated())
                .responseRate(statistics.getResponseRate())
                .averageResponseTimeMinutes(statistics.getAverageResponseTimeMinutes())
                .frictionCount(statistics.getFrictionCount())
                .frictionRate(statistics.getFrictionRate())
                .helpRequestedCount(statistics.getHelpRequestedCount())
                .helpRequestedRate(statistics.getHelpRequestedRate())
                .build();
    }
}
