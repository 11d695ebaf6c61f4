package com.taskpulse.checkin.core.engine.timeout;

import reactor.core.publisher.Mono;

/**
 * Recurring sweep that expires pending check-ins whose response window has closed.
 * Losing a race against a concurrent respond or skip is expected and not an error.
 */
public interface ITaskPulseCheckInExpirySweeper {

    void start();

    void stop();

    boolean isRunning();

    /**
     * Runs one sweep immediately and emits the number of check-ins it expired.
     */
    Mono<Integer> runOnce();
}
