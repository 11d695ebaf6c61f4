package com.taskpulse.checkin.core.engine.lifecycle;

import com.taskpulse.checkin.core.engine.store.CheckInQuery;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.contract.directory.IActiveAssignment;
import com.taskpulse.checkin.integration.enumerations.CheckInActorType;
import com.taskpulse.checkin.integration.models.checkin.CheckInSubmission;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Owner of check-in status.
 *
 * <h2>Transitions</h2>
 * <table border="1">
 *   <tr><th>Operation</th><th>From</th><th>To</th></tr>
 *   <tr><td>respond</td><td>PENDING</td><td>RESPONDED</td></tr>
 *   <tr><td>skip</td><td>PENDING</td><td>SKIPPED</td></tr>
 *   <tr><td>expire</td><td>PENDING, past its window</td><td>EXPIRED</td></tr>
 *   <tr><td>escalate</td><td>PENDING, SKIPPED, EXPIRED, RESPONDED with friction</td><td>ESCALATED</td></tr>
 * </table>
 *
 * <p>Every transition is a compare-and-swap on the expected source status. When the
 * status is not eligible, the returned {@link Mono} errors with
 * {@link com.taskpulse.checkin.core.exception.CheckInConflictException} and nothing changes.
 * Successful transitions are audited and then handed to the registered listeners.</p>
 */
public interface ITaskPulseCheckInLifecycleService {

    // ========================================================================
    // CREATION
    // ========================================================================

    /**
     * Opens a check-in on request. Fails with a conflict when the pair already has a pending one.
     */
    Mono<ICheckIn> create(CreateCheckInCommand command);

    /**
     * Opens the next scheduled check-in of an assignment.
     */
    Mono<ICheckIn> schedule(IActiveAssignment assignment, Instant scheduledAt, Instant expiresAt);

    // ========================================================================
    // TRANSITIONS
    // ========================================================================

    /**
     * Records a progress update. Blockers, a help request or a blocked indicator mark
     * friction immediately. Sentiment analysis and suggestions run in the background after
     * the response is stored; the returned check-in carries them only if they finished first.
     */
    Mono<ICheckIn> respond(String checkInId, String actorId, CheckInSubmission submission);

    Mono<ICheckIn> skip(String checkInId, String actorId, String reason);

    /**
     * Closes a pending check-in whose response window has passed.
     */
    Mono<ICheckIn> expire(String checkInId);

    /**
     * Routes the check-in to a manager. Without an explicit target the subject's manager
     * is used when the effective config allows it.
     */
    Mono<ICheckIn> escalate(String checkInId, String reason, String escalateTo, String actorId, CheckInActorType actorType);

    // ========================================================================
    // READS
    // ========================================================================

    Mono<ICheckIn> get(String checkInId);

    Flux<ICheckIn> list(CheckInQuery query);

    Mono<Long> count(CheckInQuery query);

    Flux<ICheckIn> listPending(String userId);

    // ========================================================================
    // LISTENERS
    // ========================================================================

    void onTransition(CheckInTransitionListener listener);
}
