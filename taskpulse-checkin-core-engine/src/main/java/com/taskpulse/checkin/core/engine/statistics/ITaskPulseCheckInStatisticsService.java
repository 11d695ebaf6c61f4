package com.taskpulse.checkin.core.engine.statistics;

import reactor.core.publisher.Mono;

/**
 * Read-only projections over stored check-ins.
 */
public interface ITaskPulseCheckInStatisticsService {

    /**
     * Metrics over check-ins of the scope scheduled within the last {@code days} days.
     */
    Mono<CheckInStatistics> getStatistics(StatisticsScope scope, int days);

    /**
     * The manager's "needs attention" feed. A check-in needs attention when it is escalated,
     * shows friction, or is still pending after its response window closed.
     */
    Mono<ManagerFeed> getManagerFeed(String orgId, String managerId, boolean needsAttentionOnly, int skip, int limit);
}
