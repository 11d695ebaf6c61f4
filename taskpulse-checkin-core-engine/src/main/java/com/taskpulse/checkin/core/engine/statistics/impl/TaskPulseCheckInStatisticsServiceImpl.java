package com.taskpulse.checkin.core.engine.statistics.impl;

import com.taskpulse.checkin.core.engine.statistics.CheckInStatistics;
import com.taskpulse.checkin.core.engine.statistics.ITaskPulseCheckInStatisticsService;
import com.taskpulse.checkin.core.engine.statistics.ManagerFeed;
import com.taskpulse.checkin.core.engine.statistics.ManagerFeed.FeedItem;
import com.taskpulse.checkin.core.engine.statistics.StatisticsScope;
import com.taskpulse.checkin.core.engine.store.CheckInQuery;
import com.taskpulse.checkin.core.engine.store.ICheckInStore;
import com.taskpulse.checkin.core.exception.CheckInValidationException;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
public class TaskPulseCheckInStatisticsServiceImpl implements ITaskPulseCheckInStatisticsService {

    private final ICheckInStore checkInStore;
    private final ICheckInSubjectDirectory directory;
    private final Clock clock;

    // ========================================================================
    // STATISTICS
    // ========================================================================

    @Override
    public Mono<CheckInStatistics> getStatistics(StatisticsScope scope, int days) {
        return Mono.defer(() -> {
            if (days < 1) {
                return Mono.error(new CheckInValidationException("days", "must be at least 1"));
            }
            Instant periodStart = clock.instant().minus(Duration.ofDays(days));
            CheckInQuery query = CheckInQuery.builder()
                    .orgId(scope.getOrgId())
                    .teamId(scope.getTeamId())
                    .userId(scope.getUserId())
                    .scheduledFrom(periodStart)
                    .build();
            return checkInStore.query(query)
                    .collectList()
                    .map(checkIns -> summarize(scope, days, periodStart, checkIns));
        });
    }

    private static CheckInStatistics summarize(StatisticsScope scope, int days, Instant periodStart, List<ICheckIn> checkIns) {
        Map<CheckInStatus, Long> byStatus = new EnumMap<>(CheckInStatus.class);
        for (CheckInStatus status : CheckInStatus.values()) {
            byStatus.put(status, 0L);
        }
        long friction = 0;
        long help = 0;
        long respondedWithTime = 0;
        long responseMillis = 0;

        for (ICheckIn checkIn : checkIns) {
            byStatus.merge(checkIn.getStatus(), 1L, Long::sum);
            if (checkIn.isFrictionDetected()) {
                friction++;
            }
            if (checkIn.isHelpNeeded()) {
                help++;
            }
            if (checkIn.getRespondedAt() != null) {
                respondedWithTime++;
                responseMillis += Duration.between(checkIn.getScheduledAt(), checkIn.getRespondedAt()).toMillis();
            }
        }

        long total = checkIns.size();
        long responded = byStatus.get(CheckInStatus.RESPONDED);
        Double averageMinutes = respondedWithTime == 0
                ? null
                : round1(responseMillis / (double) respondedWithTime / 60_000d);

        return CheckInStatistics.builder()
                .orgId(scope.getOrgId())
                .teamId(scope.getTeamId())
                .userId(scope.getUserId())
                .periodDays(days)
                .periodStart(periodStart)
                .total(total)
                .pending(byStatus.get(CheckInStatus.PENDING))
                .responded(responded)
                .skipped(byStatus.get(CheckInStatus.SKIPPED))
                .expired(byStatus.get(CheckInStatus.EXPIRED))
                .escalated(byStatus.get(CheckInStatus.ESCALATED))
                .responseRate(total == 0 ? 0 : responded * 100d / total)
                .averageResponseTimeMinutes(averageMinutes)
                .frictionCount(friction)
                .frictionRate(total == 0 ? 0 : round1(friction * 100d / total))
                .helpRequestedCount(help)
                .helpRequestedRate(total == 0 ? 0 : round1(help * 100d / total))
                .build();
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10d;
    }

    // ========================================================================
    // MANAGER FEED
    // ========================================================================

    @Override
    public Mono<ManagerFeed> getManagerFeed(String orgId, String managerId, boolean needsAttentionOnly, int skip, int limit) {
        return directory.getDirectReports(orgId, managerId)
                .collectList()
                .flatMap(reports -> checkInStore.query(CheckInQuery.builder()
                                .orgId(orgId)
                                .userIds(reports)
                                .build())
                        .collectList())
                .map(checkIns -> {
                    Instant now = clock.instant();
                    List<FeedItem> annotated = checkIns.stream()
                            .map(checkIn -> annotate(checkIn, now))
                            .collect(Collectors.toList());
                    long needsAttention = annotated.stream().filter(FeedItem::isNeedsAttention).count();
                    List<FeedItem> matching = needsAttentionOnly
                            ? annotated.stream().filter(FeedItem::isNeedsAttention).collect(Collectors.toList())
                            : annotated;
                    List<FeedItem> page = matching.stream()
                            .skip(Math.max(0, skip))
                            .limit(Math.max(0, limit))
                            .collect(Collectors.toList());
                    log.debug("Manager feed: managerId={}, items={}, needsAttention={}", managerId, matching.size(), needsAttention);
                    return ManagerFeed.builder()
                            .items(page)
                            .total(matching.size())
                            .needsAttentionCount(needsAttention)
                            .skip(skip)
                            .limit(limit)
                            .build();
                });
    }

    static FeedItem annotate(ICheckIn checkIn, Instant now) {
        List<String> reasons = new ArrayList<>();
        if (checkIn.isEscalated()) {
            reasons.add("Escalated: " + checkIn.getEscalationReason());
        }
        if (checkIn.isFrictionDetected()) {
            String blockers = checkIn.getBlockersReported();
            if (blockers != null && !blockers.isBlank()) {
                reasons.add("Friction detected: " + blockers.trim());
            } else if (checkIn.isHelpNeeded()) {
                reasons.add("Friction detected: help requested");
            } else {
                reasons.add("Friction detected");
            }
        }
        if (checkIn.isOverdue(now)) {
            reasons.add("No response since " + checkIn.getExpiresAt());
        }
        return FeedItem.builder()
                .checkIn(checkIn)
                .needsAttention(!reasons.isEmpty())
                .attentionReason(reasons.isEmpty() ? null : String.join("; ", reasons))
                .build();
    }
}
