package com.taskpulse.checkin.core.engine.scheduler;

import reactor.core.publisher.Mono;

/**
 * Recurring sweep that opens the next check-in of every active (task, assignee) pair.
 *
 * <p>For each pair with an enabled effective config and no pending check-in, the next slot is
 * the previous slot plus the interval (or the activation time for the first cycle), rolled
 * into the work window and pushed to a later day while the daily cap is reached. A slot
 * older than one response window is re-planned from now. The check-in is created only once
 * its slot has arrived. Running a sweep twice without any state change creates nothing
 * the second time.</p>
 */
public interface ITaskPulseCheckInScheduler {

    void start();

    void stop();

    boolean isRunning();

    /**
     * Runs one sweep immediately.
     */
    Mono<SweepResult> runOnce();

    record SweepResult(int examined, int created, int failed) {
    }
}
