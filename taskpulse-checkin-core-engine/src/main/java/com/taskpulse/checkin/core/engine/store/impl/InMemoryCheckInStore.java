package com.taskpulse.checkin.core.engine.store.impl;

import com.taskpulse.checkin.core.engine.store.CheckInQuery;
import com.taskpulse.checkin.core.engine.store.ICheckInStore;
import com.taskpulse.checkin.core.exception.CheckInConflictException;
import com.taskpulse.checkin.core.exception.CheckInNotFoundException;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import com.taskpulse.checkin.integration.models.checkin.CheckInModel;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Thread-safe in-memory check-in store.
 *
 * <p>Check-ins are grouped into one series per (task, user) pair. Inserts and transitions
 * run inside {@link ConcurrentHashMap#compute} on the pair's series, so all writes to one
 * pair are serialized while different pairs never contend. The series also tracks the
 * pending check-in, which keeps the single-pending rule and cycle numbering consistent.</p>
 */
@Slf4j
public class InMemoryCheckInStore implements ICheckInStore {

    private static final Comparator<ICheckIn> NEWEST_FIRST = Comparator
            .comparing(ICheckIn::getScheduledAt, Comparator.reverseOrder())
            .thenComparing(ICheckIn::getCycleNumber, Comparator.reverseOrder())
            .thenComparing(ICheckIn::getId);

    private final Map<String, CheckInModel> checkIns = new ConcurrentHashMap<>();
    private final Map<String, PairSeries> seriesByPair = new ConcurrentHashMap<>();

    // ========================================================================
    // WRITES
    // ========================================================================

    @Override
    public Mono<ICheckIn> insertPending(CheckInModel draft) {
        return Mono.fromCallable(() -> {
            AtomicReference<CheckInModel> stored = new AtomicReference<>();
            seriesByPair.compute(pairKey(draft.getTaskId(), draft.getUserId()), (key, series) -> {
                PairSeries current = series != null ? series : new PairSeries();
                if (current.pendingId != null) {
                    throw CheckInConflictException.alreadyPending(draft.getTaskId(), draft.getUserId());
                }
                CheckInModel checkIn = draft.toBuilder()
                        .id(UUID.randomUUID().toString())
                        .cycleNumber(current.checkInIds.size() + 1)
                        .status(CheckInStatus.PENDING)
                        .build();
                checkIns.put(checkIn.getId(), checkIn);
                current.checkInIds.add(checkIn.getId());
                current.pendingId = checkIn.getId();
                stored.set(checkIn);
                return current;
            });
            CheckInModel checkIn = stored.get();
            log.debug("Inserted check-in: id={}, taskId={}, userId={}, cycle={}",
                    checkIn.getId(), checkIn.getTaskId(), checkIn.getUserId(), checkIn.getCycleNumber());
            return checkIn;
        });
    }

    @Override
    public Mono<ICheckIn> transition(String id, Set<CheckInStatus> expectedStatuses, UnaryOperator<CheckInModel> mutator) {
        return Mono.fromCallable(() -> {
            CheckInModel existing = checkIns.get(id);
            if (existing == null) {
                throw CheckInNotFoundException.checkIn(id);
            }
            AtomicReference<CheckInModel> result = new AtomicReference<>();
            seriesByPair.compute(pairKey(existing.getTaskId(), existing.getUserId()), (key, series) -> {
                CheckInModel current = checkIns.get(id);
                if (!expectedStatuses.contains(current.getStatus())) {
                    throw CheckInConflictException.state(id, current.getStatus(), expectedStatuses);
                }
                CheckInModel updated = Objects.requireNonNull(mutator.apply(current), "mutator result");
                checkIns.put(id, updated);
                if (series != null && id.equals(series.pendingId) && updated.getStatus() != CheckInStatus.PENDING) {
                    series.pendingId = null;
                }
                result.set(updated);
                return series;
            });
            return result.get();
        });
    }

    // ========================================================================
    // READS
    // ========================================================================

    @Override
    public Mono<ICheckIn> findById(String id) {
        return Mono.justOrEmpty(checkIns.get(id));
    }

    @Override
    public Flux<ICheckIn> findSeries(String taskId, String userId) {
        return Flux.defer(() -> Flux.fromStream(seriesStream(taskId, userId)));
    }

    @Override
    public Mono<ICheckIn> findLatest(String taskId, String userId) {
        return Mono.fromCallable(() -> {
            PairSeries series = seriesByPair.get(pairKey(taskId, userId));
            if (series == null || series.checkInIds.isEmpty()) {
                return null;
            }
            return checkIns.get(series.checkInIds.get(series.checkInIds.size() - 1));
        });
    }

    @Override
    public Mono<ICheckIn> findPending(String taskId, String userId) {
        return Mono.fromCallable(() -> {
            PairSeries series = seriesByPair.get(pairKey(taskId, userId));
            String pendingId = series != null ? series.pendingId : null;
            return pendingId != null ? checkIns.get(pendingId) : null;
        });
    }

    @Override
    public Mono<Long> countScheduledBetween(String taskId, String userId, Instant from, Instant to) {
        return Mono.fromCallable(() -> seriesStream(taskId, userId)
                .filter(checkIn -> !checkIn.getScheduledAt().isBefore(from) && checkIn.getScheduledAt().isBefore(to))
                .count());
    }

    @Override
    public Flux<ICheckIn> findOverdue(Instant now) {
        return Flux.defer(() -> Flux.fromStream(checkIns.values().stream()
                .filter(checkIn -> checkIn.isOverdue(now))
                .sorted(Comparator.comparing(ICheckIn::getExpiresAt))
                .map(ICheckIn.class::cast)));
    }

    @Override
    public Flux<ICheckIn> query(CheckInQuery query) {
        return Flux.defer(() -> {
            Stream<ICheckIn> matching = checkIns.values().stream()
                    .map(ICheckIn.class::cast)
                    .filter(query::matches)
                    .sorted(NEWEST_FIRST)
                    .skip(Math.max(0, query.getSkip()));
            if (query.getLimit() > 0) {
                matching = matching.limit(query.getLimit());
            }
            return Flux.fromStream(matching);
        });
    }

    @Override
    public Mono<Long> count(CheckInQuery query) {
        return Mono.fromCallable(() -> checkIns.values().stream().filter(query::matches).count());
    }

    private Stream<ICheckIn> seriesStream(String taskId, String userId) {
        PairSeries series = seriesByPair.get(pairKey(taskId, userId));
        if (series == null) {
            return Stream.empty();
        }
        return series.checkInIds.stream().map(checkIns::get).map(ICheckIn.class::cast);
    }

    private static String pairKey(String taskId, String userId) {
        return taskId + "::" + userId;
    }

    private static final class PairSeries {
        private final List<String> checkInIds = new CopyOnWriteArrayList<>();
        private volatile String pendingId;
    }
}
