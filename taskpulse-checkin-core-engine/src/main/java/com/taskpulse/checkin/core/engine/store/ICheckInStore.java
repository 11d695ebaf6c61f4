package com.taskpulse.checkin.core.engine.store;

import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import com.taskpulse.checkin.integration.models.checkin.CheckInModel;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Storage of check-ins.
 *
 * <h2>Atomicity</h2>
 * <ul>
 *   <li>{@link #insertPending} assigns the next cycle number of the (task, user) pair and
 *       refuses the insert while the pair has a pending check-in, in one atomic step.</li>
 *   <li>{@link #transition} applies a change only if the current status is one of the
 *       expected statuses. Status is the compare-and-swap witness; there are no version numbers.</li>
 * </ul>
 * Check-ins are never deleted.
 */
public interface ICheckInStore {

    /**
     * Stores a new pending check-in. Id and cycle number of the draft are overwritten.
     *
     * @return the stored check-in, or an error of
     *         {@link com.taskpulse.checkin.core.exception.CheckInConflictException} when the pair
     *         already has a pending check-in
     */
    Mono<ICheckIn> insertPending(CheckInModel draft);

    /**
     * Atomically replaces a check-in with {@code mutator(current)} if its status is expected.
     *
     * @return the updated check-in; errors with not found or conflict, leaving the record unchanged
     */
    Mono<ICheckIn> transition(String id, Set<CheckInStatus> expectedStatuses, UnaryOperator<CheckInModel> mutator);

    Mono<ICheckIn> findById(String id);

    /**
     * All cycles of a pair in ascending cycle order.
     */
    Flux<ICheckIn> findSeries(String taskId, String userId);

    Mono<ICheckIn> findLatest(String taskId, String userId);

    Mono<ICheckIn> findPending(String taskId, String userId);

    /**
     * Number of check-ins of a pair scheduled in {@code [from, to)}.
     */
    Mono<Long> countScheduledBetween(String taskId, String userId, Instant from, Instant to);

    /**
     * Pending check-ins whose response window closed before {@code now}.
     */
    Flux<ICheckIn> findOverdue(Instant now);

    /**
     * Matching check-ins, newest first, paged by the query's skip and limit.
     */
    Flux<ICheckIn> query(CheckInQuery query);

    /**
     * Number of matching check-ins, ignoring skip and limit.
     */
    Mono<Long> count(CheckInQuery query);
}
