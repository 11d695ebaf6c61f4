package com.taskpulse.checkin.core.engine.timeout.impl;

import com.taskpulse.checkin.core.engine.config.CheckInEngineSettings;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.store.ICheckInStore;
import com.taskpulse.checkin.core.engine.timeout.ITaskPulseCheckInExpirySweeper;
import com.taskpulse.checkin.core.exception.CheckInConflictException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
public class TaskPulseCheckInExpirySweeperImpl implements ITaskPulseCheckInExpirySweeper {

    private final ICheckInStore checkInStore;
    private final ITaskPulseCheckInLifecycleService lifecycleService;
    private final CheckInEngineSettings settings;
    private final Clock clock;

    private ScheduledExecutorService executor;
    private volatile boolean running = false;

    public TaskPulseCheckInExpirySweeperImpl(ICheckInStore checkInStore,
                                             ITaskPulseCheckInLifecycleService lifecycleService,
                                             CheckInEngineSettings settings,
                                             Clock clock) {
        this.checkInStore = checkInStore;
        this.lifecycleService = lifecycleService;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "checkin-expiry-sweeper");
            t.setDaemon(true);
            return t;
        });
        long periodMillis = settings.getExpirySweepInterval().toMillis();
        executor.scheduleWithFixedDelay(this::tick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Expiry sweeper started: interval={}", settings.getExpirySweepInterval());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Expiry sweeper stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void tick() {
        try {
            runOnce().block();
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed", e);
        }
    }

    @Override
    public Mono<Integer> runOnce() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return checkInStore.findOverdue(now)
                    .concatMap(overdue -> lifecycleService.expire(overdue.getId())
                            .onErrorResume(CheckInConflictException.class, e -> {
                                log.debug("Check-in {} changed before it could expire: {}", overdue.getId(), e.getMessage());
                                return Mono.empty();
                            })
                            .onErrorResume(e -> {
                                log.warn("Failed to expire check-in {}: {}", overdue.getId(), e.getMessage());
                                return Mono.empty();
                            }))
                    .count()
                    .map(Long::intValue)
                    .doOnNext(expired -> {
                        if (expired > 0) {
                            log.info("Expiry sweep: expired={}", expired);
                        } else {
                            log.debug("Expiry sweep: nothing overdue");
                        }
                    });
        });
    }
}
