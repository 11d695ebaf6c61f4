package com.taskpulse.checkin.core.engine.scheduler.impl;

import com.taskpulse.checkin.core.engine.config.CheckInEngineSettings;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigResolver;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.scheduler.CheckInSlotCalculator;
import com.taskpulse.checkin.core.engine.scheduler.ITaskPulseCheckInScheduler;
import com.taskpulse.checkin.core.engine.store.ICheckInStore;
import com.taskpulse.checkin.core.exception.CheckInConflictException;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.contract.directory.IActiveAssignment;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-node scheduler running sweeps on a daemon {@link ScheduledExecutorService}.
 * Sweeps never overlap; a tick that arrives while a sweep is running is dropped.
 */
@Slf4j
public class TaskPulseCheckInSchedulerImpl implements ITaskPulseCheckInScheduler {

    // Upper bound on day-by-day deferrals when every day is capped.
    private static final int MAX_CAP_DEFERRALS = 31;

    private final ICheckInSubjectDirectory directory;
    private final ITaskPulseCheckInConfigResolver configResolver;
    private final ICheckInStore checkInStore;
    private final ITaskPulseCheckInLifecycleService lifecycleService;
    private final CheckInEngineSettings settings;
    private final Clock clock;

    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private ScheduledExecutorService executor;
    private volatile boolean running = false;

    public TaskPulseCheckInSchedulerImpl(ICheckInSubjectDirectory directory,
                                         ITaskPulseCheckInConfigResolver configResolver,
                                         ICheckInStore checkInStore,
                                         ITaskPulseCheckInLifecycleService lifecycleService,
                                         CheckInEngineSettings settings,
                                         Clock clock) {
        this.directory = directory;
        this.configResolver = configResolver;
        this.checkInStore = checkInStore;
        this.lifecycleService = lifecycleService;
        this.settings = settings;
        this.clock = clock;
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "checkin-scheduler");
            t.setDaemon(true);
            return t;
        });
        long periodMillis = settings.getSchedulerInterval().toMillis();
        executor.scheduleWithFixedDelay(this::tick, 0, periodMillis, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Check-in scheduler started: interval={}", settings.getSchedulerInterval());
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
        log.info("Check-in scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void tick() {
        try {
            runOnce().block();
        } catch (RuntimeException e) {
            log.error("Check-in scheduler sweep failed", e);
        }
    }

    // ========================================================================
    // SWEEP
    // ========================================================================

    @Override
    public Mono<SweepResult> runOnce() {
        return Mono.defer(() -> {
            if (!sweeping.compareAndSet(false, true)) {
                log.debug("Scheduler sweep already in progress, skipping");
                return Mono.just(new SweepResult(0, 0, 0));
            }
            Instant now = clock.instant();
            AtomicInteger examined = new AtomicInteger();
            AtomicInteger created = new AtomicInteger();
            AtomicInteger failed = new AtomicInteger();

            return directory.listActiveAssignments()
                    .concatMap(assignment -> {
                        examined.incrementAndGet();
                        return processAssignment(assignment, now)
                                .doOnNext(checkIn -> created.incrementAndGet())
                                .onErrorResume(CheckInConflictException.class, e -> {
                                    log.debug("Pair already has a pending check-in: taskId={}, userId={}",
                                            assignment.getTaskId(), assignment.getAssigneeId());
                                    return Mono.empty();
                                })
                                .onErrorResume(e -> {
                                    failed.incrementAndGet();
                                    log.warn("Scheduling failed for task {} of user {}: {}",
                                            assignment.getTaskId(), assignment.getAssigneeId(), e.getMessage());
                                    return Mono.empty();
                                });
                    })
                    .then(Mono.fromCallable(() -> new SweepResult(examined.get(), created.get(), failed.get())))
                    .doOnNext(result -> {
                        if (result.created() > 0 || result.failed() > 0) {
                            log.info("Scheduler sweep: examined={}, created={}, failed={}",
                                    result.examined(), result.created(), result.failed());
                        } else {
                            log.debug("Scheduler sweep: examined={}, nothing due", result.examined());
                        }
                    })
                    .doFinally(signal -> sweeping.set(false));
        });
    }

    private Mono<ICheckIn> processAssignment(IActiveAssignment assignment, Instant now) {
        return configResolver.resolve(assignment.getOrgId(), assignment.getTeamId(),
                        assignment.getAssigneeId(), assignment.getTaskId())
                .filter(ICheckInConfig::isEnabled)
                .flatMap(config -> checkInStore.findPending(assignment.getTaskId(), assignment.getAssigneeId())
                        .hasElement()
                        .filter(hasPending -> !hasPending)
                        .flatMap(noPending -> planSlot(assignment, config, now))
                        .filter(slot -> !slot.toInstant().isAfter(now))
                        .flatMap(slot -> {
                            Instant scheduledAt = slot.toInstant();
                            Duration window = settings.responseWindow(config.getResponseWindowMinutes());
                            return lifecycleService.schedule(assignment, scheduledAt, scheduledAt.plus(window));
                        }));
    }

    /**
     * Next slot of a pair, rolled into the work window and respecting the daily cap.
     */
    Mono<ZonedDateTime> planSlot(IActiveAssignment assignment, ICheckInConfig config, Instant now) {
        ZoneId zone = zoneOf(assignment, config);
        Duration window = settings.responseWindow(config.getResponseWindowMinutes());

        return checkInStore.findLatest(assignment.getTaskId(), assignment.getAssigneeId())
                .map(last -> last.getScheduledAt().plus(CheckInSlotCalculator.interval(config)))
                .defaultIfEmpty(assignment.getActivatedAt() != null ? assignment.getActivatedAt() : now)
                .flatMap(candidate -> applyDailyCap(assignment, config,
                        CheckInSlotCalculator.rollIntoWorkWindow(candidate, zone, config), 0))
                .flatMap(slot -> {
                    if (slot.toInstant().plus(window).isBefore(now)) {
                        log.debug("Slot {} of task {} is stale, re-planning from now", slot, assignment.getTaskId());
                        return applyDailyCap(assignment, config,
                                CheckInSlotCalculator.rollIntoWorkWindow(now, zone, config), 0);
                    }
                    return Mono.just(slot);
                });
    }

    private Mono<ZonedDateTime> applyDailyCap(IActiveAssignment assignment, ICheckInConfig config,
                                              ZonedDateTime slot, int deferrals) {
        return checkInStore.countScheduledBetween(assignment.getTaskId(), assignment.getAssigneeId(),
                        CheckInSlotCalculator.startOfDay(slot), CheckInSlotCalculator.endOfDay(slot))
                .flatMap(count -> {
                    if (count < config.getMaxDailyCheckins()) {
                        return Mono.just(slot);
                    }
                    if (deferrals >= MAX_CAP_DEFERRALS) {
                        log.warn("Daily cap reached on {} consecutive days for task {}", deferrals, assignment.getTaskId());
                        return Mono.empty();
                    }
                    ZonedDateTime next = CheckInSlotCalculator.firstSlotAfter(slot.toLocalDate(), slot.getZone(), config);
                    return applyDailyCap(assignment, config, next, deferrals + 1);
                });
    }

    private ZoneId zoneOf(IActiveAssignment assignment, ICheckInConfig config) {
        if (config.isRespectTimezone() && assignment.getZone() != null) {
            return assignment.getZone();
        }
        return settings.getDefaultZone();
    }
}
