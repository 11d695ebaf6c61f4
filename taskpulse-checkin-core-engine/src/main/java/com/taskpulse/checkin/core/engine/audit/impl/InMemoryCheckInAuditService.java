package com.taskpulse.checkin.core.engine.audit.impl;

import com.taskpulse.checkin.core.engine.audit.CheckInTransitionRecord;
import com.taskpulse.checkin.core.engine.audit.ITaskPulseCheckInAuditService;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transition log indexed by check-in.
 */
@Slf4j
public class InMemoryCheckInAuditService implements ITaskPulseCheckInAuditService {

    private final Map<String, List<CheckInTransitionRecord>> byCheckIn = new ConcurrentHashMap<>();

    @Override
    public Mono<CheckInTransitionRecord> record(CheckInTransitionRecord record) {
        return Mono.fromCallable(() -> {
            byCheckIn.computeIfAbsent(record.getCheckInId(), k -> new CopyOnWriteArrayList<>()).add(record);
            log.debug("Audit: checkInId={}, {} -> {}, actor={} ({})", record.getCheckInId(),
                    record.getFrom(), record.getTo(), record.getActor(), record.getActorType());
            return record;
        });
    }

    @Override
    public Flux<CheckInTransitionRecord> getHistory(String checkInId) {
        return Flux.defer(() -> Flux.fromIterable(byCheckIn.getOrDefault(checkInId, List.of())));
    }

    @Override
    public Mono<Long> countHistory(String checkInId) {
        return Mono.fromCallable(() -> (long) byCheckIn.getOrDefault(checkInId, List.of()).size());
    }
}
