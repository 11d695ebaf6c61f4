package com.taskpulse.checkin.core.engine.statistics;

import lombok.Builder;
import lombok.Data;

/**
 * Population a statistics request covers: an organization, optionally narrowed to a team or a user.
 */
@Data
@Builder
public class StatisticsScope {
    private final String orgId;
    private final String teamId;
    private final String userId;
}
