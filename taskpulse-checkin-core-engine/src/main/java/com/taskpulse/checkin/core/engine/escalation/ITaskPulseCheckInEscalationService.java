package com.taskpulse.checkin.core.engine.escalation;

import com.taskpulse.checkin.core.engine.lifecycle.CheckInTransitionListener;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import reactor.core.publisher.Mono;

/**
 * Automatic escalation policy.
 *
 * <ul>
 *   <li>Missed streak: after a skip or expiry, the pair's cycles are walked backwards from the
 *       most recent one, counting cycles without a submission. Reaching the configured
 *       {@code autoEscalateAfterMissed} escalates the latest cycle.</li>
 *   <li>Silent mode: a response showing friction is escalated to the manager when the
 *       effective config allows it; otherwise the manager is only notified.</li>
 * </ul>
 */
public interface ITaskPulseCheckInEscalationService extends CheckInTransitionListener {

    /**
     * Number of consecutive cycles without a submission, ending at the pair's latest cycle.
     */
    Mono<Integer> countMissedStreak(String taskId, String userId);

    /**
     * Evaluates the missed streak of the given (skipped or expired) check-in and escalates it
     * if the threshold is reached. Completes empty when nothing was escalated.
     */
    Mono<ICheckIn> evaluateMissedStreak(ICheckIn checkIn);

    /**
     * Escalates or reports a response showing friction. Completes empty when nothing was escalated.
     */
    Mono<ICheckIn> evaluateFriction(ICheckIn checkIn);
}
