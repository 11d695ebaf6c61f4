package com.taskpulse.checkin.core.engine.store;

import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * Filter over stored check-ins. Unset fields do not filter.
 */
@Data
@Builder(toBuilder = true)
@With
public class CheckInQuery {

    private final String orgId;
    private final String teamId;
    private final String taskId;
    private final String userId;

    /**
     * Matches any of the listed users; combined with {@link #userId} when both are set.
     */
    private final Collection<String> userIds;

    private final Set<CheckInStatus> statuses;

    /**
     * Inclusive lower bound on {@code scheduledAt}.
     */
    private final Instant scheduledFrom;

    @Builder.Default
    private final int skip = 0;

    /**
     * Maximum number of results, {@code 0} for no limit.
     */
    @Builder.Default
    private final int limit = 0;

    public static CheckInQuery all() {
        return CheckInQuery.builder().build();
    }

    public boolean matches(ICheckIn checkIn) {
        return (orgId == null || orgId.equals(checkIn.getOrgId()))
                && (teamId == null || teamId.equals(checkIn.getTeamId()))
                && (taskId == null || taskId.equals(checkIn.getTaskId()))
                && (userId == null || userId.equals(checkIn.getUserId()))
                && (userIds == null || userIds.contains(checkIn.getUserId()))
                && (statuses == null || statuses.isEmpty() || statuses.contains(checkIn.getStatus()))
                && (scheduledFrom == null || !checkIn.getScheduledAt().isBefore(scheduledFrom));
    }
}
