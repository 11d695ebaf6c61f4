package com.taskpulse.checkin.core.engine.escalation.impl;

import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigResolver;
import com.taskpulse.checkin.core.engine.escalation.ITaskPulseCheckInEscalationService;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.notification.CheckInNotificationEvent;
import com.taskpulse.checkin.core.engine.notification.ICheckInNotificationService;
import com.taskpulse.checkin.core.engine.store.ICheckInStore;
import com.taskpulse.checkin.core.exception.CheckInConflictException;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import com.taskpulse.checkin.integration.enumerations.CheckInActorType;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import com.taskpulse.checkin.integration.enumerations.ProgressIndicator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Slf4j
public class TaskPulseCheckInEscalationServiceImpl implements ITaskPulseCheckInEscalationService {

    public static final String ESCALATION_ACTOR = "escalation-engine";

    private static final Set<CheckInStatus> MISSED = EnumSet.of(
            CheckInStatus.SKIPPED, CheckInStatus.EXPIRED, CheckInStatus.ESCALATED);

    private final ITaskPulseCheckInLifecycleService lifecycleService;
    private final ICheckInStore checkInStore;
    private final ITaskPulseCheckInConfigResolver configResolver;
    private final ICheckInSubjectDirectory directory;
    private final ICheckInNotificationService notificationService;
    private final Clock clock;

    public TaskPulseCheckInEscalationServiceImpl(ITaskPulseCheckInLifecycleService lifecycleService,
                                                 ICheckInStore checkInStore,
                                                 ITaskPulseCheckInConfigResolver configResolver,
                                                 ICheckInSubjectDirectory directory,
                                                 ICheckInNotificationService notificationService,
                                                 Clock clock) {
        this.lifecycleService = lifecycleService;
        this.checkInStore = checkInStore;
        this.configResolver = configResolver;
        this.directory = directory;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    /**
     * Creates the service and registers it as a transition listener of the lifecycle.
     */
    public static TaskPulseCheckInEscalationServiceImpl register(ITaskPulseCheckInLifecycleService lifecycleService,
                                                                 ICheckInStore checkInStore,
                                                                 ITaskPulseCheckInConfigResolver configResolver,
                                                                 ICheckInSubjectDirectory directory,
                                                                 ICheckInNotificationService notificationService,
                                                                 Clock clock) {
        TaskPulseCheckInEscalationServiceImpl service = new TaskPulseCheckInEscalationServiceImpl(
                lifecycleService, checkInStore, configResolver, directory, notificationService, clock);
        lifecycleService.onTransition(service);
        return service;
    }

    @Override
    public Mono<Void> onTransition(ICheckIn checkIn, CheckInStatus from, CheckInStatus to) {
        if (from == null) {
            return Mono.empty();
        }
        switch (to) {
            case SKIPPED:
            case EXPIRED:
                return evaluateMissedStreak(checkIn).then();
            case RESPONDED:
                return checkIn.isFrictionDetected() ? evaluateFriction(checkIn).then() : Mono.empty();
            default:
                return Mono.empty();
        }
    }

    // ========================================================================
    // MISSED STREAK
    // ========================================================================

    @Override
    public Mono<Integer> countMissedStreak(String taskId, String userId) {
        return checkInStore.findSeries(taskId, userId)
                .collectList()
                .map(TaskPulseCheckInEscalationServiceImpl::trailingMisses);
    }

    @Override
    public Mono<ICheckIn> evaluateMissedStreak(ICheckIn checkIn) {
        return configResolver.resolve(checkIn.getOrgId(), checkIn.getTeamId(), checkIn.getUserId(), checkIn.getTaskId())
                .flatMap(config -> countMissedStreak(checkIn.getTaskId(), checkIn.getUserId())
                        .flatMap(streak -> {
                            if (streak < config.getAutoEscalateAfterMissed()) {
                                log.debug("Missed streak below threshold: checkInId={}, streak={}, threshold={}",
                                        checkIn.getId(), streak, config.getAutoEscalateAfterMissed());
                                return Mono.empty();
                            }
                            String reason = "auto: " + streak + " consecutive missed check-ins";
                            return escalateToManager(checkIn, config, reason);
                        }));
    }

    static int trailingMisses(List<ICheckIn> series) {
        int streak = 0;
        for (int i = series.size() - 1; i >= 0; i--) {
            ICheckIn cycle = series.get(i);
            if (cycle.hasSubmission() || !MISSED.contains(cycle.getStatus())) {
                break;
            }
            streak++;
        }
        return streak;
    }

    // ========================================================================
    // FRICTION
    // ========================================================================

    @Override
    public Mono<ICheckIn> evaluateFriction(ICheckIn checkIn) {
        return configResolver.resolve(checkIn.getOrgId(), checkIn.getTeamId(), checkIn.getUserId(), checkIn.getTaskId())
                .flatMap(config -> {
                    String reason = "auto: friction detected (" + describeFriction(checkIn, config) + ")";
                    if (config.isEscalateToManager()) {
                        return escalateToManager(checkIn, config, reason);
                    }
                    return directory.getManagerOf(checkIn.getOrgId(), checkIn.getUserId())
                            .flatMap(manager -> notificationService
                                    .notify(CheckInNotificationEvent.frictionDetected(checkIn, manager, clock.instant()))
                                    .onErrorResume(e -> {
                                        log.warn("Friction notification failed: checkInId={}: {}", checkIn.getId(), e.toString());
                                        return Mono.empty();
                                    }))
                            .then(Mono.<ICheckIn>empty());
                });
    }

    private static String describeFriction(ICheckIn checkIn, ICheckInConfig config) {
        if (checkIn.getBlockersReported() != null && !checkIn.getBlockersReported().isBlank()) {
            return "blockers: " + checkIn.getBlockersReported().trim();
        }
        if (checkIn.getProgressIndicator() == ProgressIndicator.BLOCKED) {
            return checkIn.isHelpNeeded() ? "blocked, help requested" : "blocked";
        }
        if (checkIn.isHelpNeeded()) {
            return "help requested";
        }
        if (checkIn.getSentimentScore() != null) {
            return String.format(Locale.ROOT, "sentiment %.2f below %.2f", checkIn.getSentimentScore(), config.getSilentModeThreshold());
        }
        return "reported by subject";
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private Mono<ICheckIn> escalateToManager(ICheckIn checkIn, ICheckInConfig config, String reason) {
        if (!config.isEscalateToManager()) {
            log.info("Escalation to manager disabled: checkInId={}, reason={}", checkIn.getId(), reason);
            return Mono.empty();
        }
        return directory.getManagerOf(checkIn.getOrgId(), checkIn.getUserId())
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("No escalation target for check-in {} of user {}: {}",
                            checkIn.getId(), checkIn.getUserId(), reason);
                    return Mono.empty();
                }))
                .flatMap(manager -> lifecycleService.escalate(checkIn.getId(), reason, manager,
                        ESCALATION_ACTOR, CheckInActorType.SYSTEM))
                .onErrorResume(CheckInConflictException.class, e -> {
                    log.info("Check-in {} not escalated, already changed: {}", checkIn.getId(), e.getMessage());
                    return Mono.empty();
                });
    }
}
