package com.taskpulse.checkin.core.engine.lifecycle;

import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import reactor.core.publisher.Mono;

/**
 * Observer of successful check-in transitions. Listeners run in the reactive chain
 * of the transition that triggered them, after the change is stored.
 * {@code from} is {@code null} when the check-in was just created. When background
 * enrichment finds friction on an answered check-in, listeners are called again with
 * {@code RESPONDED -> RESPONDED}.
 */
@FunctionalInterface
public interface CheckInTransitionListener {

    Mono<Void> onTransition(ICheckIn checkIn, CheckInStatus from, CheckInStatus to);
}
