package com.taskpulse.checkin.core.engine.statistics;

import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Check-ins of a manager's direct reports, newest first.
 */
@Data
@Builder
public class ManagerFeed {

    private final List<FeedItem> items;

    /**
     * Number of items matching the request before paging.
     */
    private final long total;

    /**
     * Number of direct-report check-ins needing attention, regardless of the filter.
     */
    private final long needsAttentionCount;

    private final int skip;
    private final int limit;

    @Data
    @Builder
    public static class FeedItem {
        private final ICheckIn checkIn;
        private final boolean needsAttention;
        private final String attentionReason;
    }
}
