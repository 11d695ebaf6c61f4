package com.taskpulse.checkin.core.engine.audit;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only log of check-in transitions.
 *
 * <p>Records capture who acted (actor id and type), what changed (source and target
 * status with a detail line) and when.</p>
 */
public interface ITaskPulseCheckInAuditService {

    Mono<CheckInTransitionRecord> record(CheckInTransitionRecord record);

    /**
     * History of one check-in in the order it happened.
     */
    Flux<CheckInTransitionRecord> getHistory(String checkInId);

    Mono<Long> countHistory(String checkInId);
}
