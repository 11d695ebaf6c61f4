package com.taskpulse.checkin.core.engine.lifecycle.impl;

import com.taskpulse.checkin.core.engine.audit.CheckInTransitionRecord;
import com.taskpulse.checkin.core.engine.audit.ITaskPulseCheckInAuditService;
import com.taskpulse.checkin.core.engine.config.CheckInEngineSettings;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigResolver;
import com.taskpulse.checkin.core.engine.enrichment.CheckInEnrichmentAdapter;
import com.taskpulse.checkin.core.engine.lifecycle.CheckInTransitionListener;
import com.taskpulse.checkin.core.engine.lifecycle.CreateCheckInCommand;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.notification.CheckInNotificationEvent;
import com.taskpulse.checkin.core.engine.notification.ICheckInNotificationService;
import com.taskpulse.checkin.core.engine.store.CheckInQuery;
import com.taskpulse.checkin.core.engine.store.ICheckInStore;
import com.taskpulse.checkin.core.exception.CheckInConflictException;
import com.taskpulse.checkin.core.exception.CheckInNotFoundException;
import com.taskpulse.checkin.core.exception.CheckInPolicyException;
import com.taskpulse.checkin.core.exception.CheckInValidationException;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.contract.directory.IActiveAssignment;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import com.taskpulse.checkin.integration.contract.enrichment.IEnrichmentResult;
import com.taskpulse.checkin.integration.enumerations.CheckInActorType;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import com.taskpulse.checkin.integration.enumerations.CheckInTrigger;
import com.taskpulse.checkin.integration.models.checkin.CheckInModel;
import com.taskpulse.checkin.integration.models.checkin.CheckInSubmission;
import com.taskpulse.checkin.integration.models.enrichment.EnrichmentResult;
import com.taskpulse.checkin.integration.models.enrichment.SuggestionRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Check-in state machine backed by an {@link ICheckInStore}.
 *
 * <p>Each operation builds the target state in a mutator passed to
 * {@link ICheckInStore#transition}, which applies it only while the source status is
 * still expected. Side effects (audit, notifications, listeners) run after the swap and
 * only for the caller whose swap landed.</p>
 */
@Slf4j
public class TaskPulseCheckInLifecycleServiceImpl implements ITaskPulseCheckInLifecycleService {

    public static final String SYSTEM_ACTOR = "system";

    private static final Set<CheckInStatus> PENDING_ONLY = EnumSet.of(CheckInStatus.PENDING);
    private static final Set<CheckInStatus> MISSED_OR_PENDING =
            EnumSet.of(CheckInStatus.PENDING, CheckInStatus.SKIPPED, CheckInStatus.EXPIRED);
    private static final Set<CheckInStatus> ESCALATABLE =
            EnumSet.of(CheckInStatus.PENDING, CheckInStatus.SKIPPED, CheckInStatus.EXPIRED, CheckInStatus.RESPONDED);
    // silent-mode escalation may land before enrichment does
    private static final Set<CheckInStatus> ENRICHABLE = EnumSet.of(CheckInStatus.RESPONDED, CheckInStatus.ESCALATED);

    private final ICheckInStore checkInStore;
    private final ITaskPulseCheckInConfigResolver configResolver;
    private final ICheckInSubjectDirectory directory;
    private final CheckInEnrichmentAdapter enrichmentAdapter;
    private final ITaskPulseCheckInAuditService auditService;
    private final ICheckInNotificationService notificationService;
    private final CheckInEngineSettings settings;
    private final Clock clock;

    private final List<CheckInTransitionListener> listeners = new CopyOnWriteArrayList<>();

    public TaskPulseCheckInLifecycleServiceImpl(ICheckInStore checkInStore,
                                                ITaskPulseCheckInConfigResolver configResolver,
                                                ICheckInSubjectDirectory directory,
                                                CheckInEnrichmentAdapter enrichmentAdapter,
                                                ITaskPulseCheckInAuditService auditService,
                                                ICheckInNotificationService notificationService,
                                                CheckInEngineSettings settings,
                                                Clock clock) {
        this.checkInStore = checkInStore;
        this.configResolver = configResolver;
        this.directory = directory;
        this.enrichmentAdapter = enrichmentAdapter;
        this.auditService = auditService;
        this.notificationService = notificationService;
        this.settings = settings;
        this.clock = clock;
    }

    // ========================================================================
    // CREATION
    // ========================================================================

    @Override
    public Mono<ICheckIn> create(CreateCheckInCommand command) {
        return Mono.defer(() -> {
            if (isBlank(command.getTaskId())) {
                return Mono.error(new CheckInValidationException("task_id", "is required"));
            }
            return directory.getAssignment(command.getTaskId())
                    .filter(assignment -> command.getOrgId() == null || command.getOrgId().equals(assignment.getOrgId()))
                    .switchIfEmpty(Mono.error(() -> CheckInNotFoundException.task(command.getTaskId())))
                    .flatMap(assignment -> {
                        String userId = isBlank(command.getUserId()) ? assignment.getAssigneeId() : command.getUserId();
                        return configResolver.resolve(assignment.getOrgId(), assignment.getTeamId(), userId, assignment.getTaskId())
                                .flatMap(config -> {
                                    Instant now = clock.instant();
                                    Instant expiresAt = now.plus(settings.responseWindow(config.getResponseWindowMinutes()));
                                    return insert(assignment, userId, command.getTrigger(), now, expiresAt,
                                            command.getActorId(), command.getActorType());
                                });
                    });
        });
    }

    @Override
    public Mono<ICheckIn> schedule(IActiveAssignment assignment, Instant scheduledAt, Instant expiresAt) {
        return insert(assignment, assignment.getAssigneeId(), CheckInTrigger.SCHEDULED, scheduledAt, expiresAt,
                SYSTEM_ACTOR, CheckInActorType.SYSTEM);
    }

    private Mono<ICheckIn> insert(IActiveAssignment assignment, String userId, CheckInTrigger trigger,
                                  Instant scheduledAt, Instant expiresAt, String actorId, CheckInActorType actorType) {
        if (!expiresAt.isAfter(scheduledAt)) {
            return Mono.error(new CheckInValidationException("expires_at", "must be after scheduled_at"));
        }
        Instant now = clock.instant();
        CheckInModel draft = CheckInModel.builder()
                .orgId(assignment.getOrgId())
                .teamId(assignment.getTeamId())
                .taskId(assignment.getTaskId())
                .userId(userId)
                .trigger(trigger != null ? trigger : CheckInTrigger.MANUAL)
                .status(CheckInStatus.PENDING)
                .scheduledAt(scheduledAt)
                .expiresAt(expiresAt)
                .createdAt(now)
                .updatedAt(now)
                .build();

        return checkInStore.insertPending(draft)
                .doOnNext(created -> log.info("Check-in created: id={}, taskId={}, userId={}, cycle={}, trigger={}, expiresAt={}",
                        created.getId(), created.getTaskId(), created.getUserId(), created.getCycleNumber(),
                        created.getTrigger(), created.getExpiresAt()))
                .flatMap(created -> notifySafely(CheckInNotificationEvent.checkInDue(created, assignment.getTaskTitle(), now))
                        .thenReturn(created))
                .flatMap(created -> afterTransition(created, null, actorId, actorType,
                        "created by " + created.getTrigger().toJson() + " trigger"));
    }

    // ========================================================================
    // TRANSITIONS
    // ========================================================================

    @Override
    public Mono<ICheckIn> respond(String checkInId, String actorId, CheckInSubmission submission) {
        return Mono.defer(() -> {
            if (submission == null || submission.getProgressIndicator() == null) {
                return Mono.error(new CheckInValidationException("progress_indicator", "is required"));
            }
            Instant now = clock.instant();
            return checkInStore.transition(checkInId, PENDING_ONLY, current -> current.toBuilder()
                            .status(CheckInStatus.RESPONDED)
                            .respondedAt(now)
                            .progressIndicator(submission.getProgressIndicator())
                            .progressNotes(submission.getProgressNotes())
                            .completedSinceLast(submission.getCompletedSinceLast())
                            .blockersReported(submission.getBlockersReported())
                            .helpNeeded(submission.isHelpNeeded())
                            .estimatedCompletionChange(submission.getEstimatedCompletionChange())
                            .frictionDetected(submission.signalsFriction())
                            .updatedAt(now)
                            .build())
                    .doOnNext(responded -> log.info("Check-in responded: id={}, userId={}, progress={}, friction={}",
                            responded.getId(), responded.getUserId(), responded.getProgressIndicator(),
                            responded.isFrictionDetected()))
                    .flatMap(responded -> afterTransition(responded, CheckInStatus.PENDING, actorId, CheckInActorType.USER,
                            "responded " + submission.getProgressIndicator().toJson()))
                    .doOnNext(responded -> enrichInBackground(responded, submission))
                    .flatMap(done -> get(checkInId));
        });
    }

    @Override
    public Mono<ICheckIn> skip(String checkInId, String actorId, String reason) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            String skipReason = isBlank(reason) ? null : reason.trim();
            return checkInStore.transition(checkInId, PENDING_ONLY, current -> current.toBuilder()
                            .status(CheckInStatus.SKIPPED)
                            .respondedAt(now)
                            .skipReason(skipReason)
                            .updatedAt(now)
                            .build())
                    .doOnNext(skipped -> log.info("Check-in skipped: id={}, userId={}, reason={}",
                            skipped.getId(), skipped.getUserId(), skipReason))
                    .flatMap(skipped -> afterTransition(skipped, CheckInStatus.PENDING, actorId, CheckInActorType.USER,
                            skipReason != null ? "skipped: " + skipReason : "skipped"))
                    .flatMap(done -> get(checkInId));
        });
    }

    @Override
    public Mono<ICheckIn> expire(String checkInId) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return checkInStore.transition(checkInId, PENDING_ONLY, current -> {
                        if (!current.isOverdue(now)) {
                            throw CheckInConflictException.notExpired(current.getId(), current.getExpiresAt());
                        }
                        return current.toBuilder()
                                .status(CheckInStatus.EXPIRED)
                                .updatedAt(now)
                                .build();
                    })
                    .doOnNext(expired -> log.info("Check-in expired: id={}, userId={}, expiresAt={}",
                            expired.getId(), expired.getUserId(), expired.getExpiresAt()))
                    .flatMap(expired -> notifySafely(CheckInNotificationEvent.checkInExpired(expired, now))
                            .thenReturn(expired))
                    .flatMap(expired -> afterTransition(expired, CheckInStatus.PENDING, SYSTEM_ACTOR, CheckInActorType.TIMER,
                            "response window closed at " + expired.getExpiresAt()))
                    .flatMap(done -> get(checkInId));
        });
    }

    @Override
    public Mono<ICheckIn> escalate(String checkInId, String reason, String escalateTo,
                                   String actorId, CheckInActorType actorType) {
        return Mono.defer(() -> {
            if (isBlank(reason)) {
                return Mono.error(new CheckInValidationException("reason", "is required"));
            }
            return get(checkInId)
                    .flatMap(current -> {
                        if (!isEscalatable(current)) {
                            return Mono.error(CheckInConflictException.state(checkInId, current.getStatus(), MISSED_OR_PENDING));
                        }
                        return resolveEscalationTarget(current, escalateTo);
                    })
                    .flatMap(target -> {
                        Instant now = clock.instant();
                        AtomicReference<CheckInStatus> from = new AtomicReference<>();
                        return checkInStore.transition(checkInId, ESCALATABLE, current -> {
                                    if (!isEscalatable(current)) {
                                        throw CheckInConflictException.state(checkInId, current.getStatus(), MISSED_OR_PENDING);
                                    }
                                    from.set(current.getStatus());
                                    return current.toBuilder()
                                            .status(CheckInStatus.ESCALATED)
                                            .escalated(true)
                                            .escalatedTo(target)
                                            .escalatedAt(now)
                                            .escalationReason(reason.trim())
                                            .updatedAt(now)
                                            .build();
                                })
                                .doOnNext(escalated -> log.info("Check-in escalated: id={}, from={}, to={}, reason={}",
                                        escalated.getId(), from.get(), target, escalated.getEscalationReason()))
                                .flatMap(escalated -> notifySafely(CheckInNotificationEvent.checkInEscalated(escalated, now))
                                        .thenReturn(escalated))
                                .flatMap(escalated -> afterTransition(escalated, from.get(), actorId, actorType,
                                        escalated.getEscalationReason()));
                    });
        });
    }

    // ========================================================================
    // READS
    // ========================================================================

    @Override
    public Mono<ICheckIn> get(String checkInId) {
        return checkInStore.findById(checkInId)
                .switchIfEmpty(Mono.error(() -> CheckInNotFoundException.checkIn(checkInId)));
    }

    @Override
    public Flux<ICheckIn> list(CheckInQuery query) {
        return checkInStore.query(query);
    }

    @Override
    public Mono<Long> count(CheckInQuery query) {
        return checkInStore.count(query);
    }

    @Override
    public Flux<ICheckIn> listPending(String userId) {
        return checkInStore.query(CheckInQuery.builder()
                .userId(userId)
                .statuses(PENDING_ONLY)
                .build());
    }

    @Override
    public void onTransition(CheckInTransitionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ========================================================================
    // ENRICHMENT
    // ========================================================================

    /**
     * Runs enrichment detached from the respond call. A gateway that answers at once
     * completes before {@code respond} reads the check-in back; a slow one lands later.
     */
    private void enrichInBackground(ICheckIn responded, CheckInSubmission submission) {
        enrich(responded, submission)
                .subscribe(
                        enriched -> log.debug("Check-in enriched: id={}, sentiment={}, friction={}",
                                enriched.getId(), enriched.getSentimentScore(), enriched.isFrictionDetected()),
                        e -> log.warn("Enrichment of check-in {} failed: {}", responded.getId(), e.toString()));
    }

    private Mono<ICheckIn> enrich(ICheckIn responded, CheckInSubmission submission) {
        return configResolver.resolve(responded.getOrgId(), responded.getTeamId(), responded.getUserId(), responded.getTaskId())
                .flatMap(config -> applyEnrichment(responded, submission, config))
                .onErrorResume(CheckInPolicyException.class, e -> {
                    log.warn("Skipping enrichment of check-in {}: {}", responded.getId(), e.getMessage());
                    return Mono.just(responded);
                });
    }

    private Mono<ICheckIn> applyEnrichment(ICheckIn responded, CheckInSubmission submission, ICheckInConfig config) {
        Mono<IEnrichmentResult> sentiment = config.isAiSentimentAnalysis()
                ? enrichmentAdapter.analyzeSentiment(submission.toAnalysisText())
                : Mono.just(EnrichmentResult.empty());

        return sentiment.flatMap(sentimentResult -> {
            Double score = sentimentResult.getSentimentScore();
            boolean lowSentiment = score != null && score < config.getSilentModeThreshold();
            boolean friction = responded.isFrictionDetected() || lowSentiment;

            Mono<IEnrichmentResult> suggestion = config.isAiSuggestionsEnabled() && friction
                    ? requestSuggestion(responded, submission)
                    : Mono.just(EnrichmentResult.empty());

            return suggestion.flatMap(suggestionResult -> {
                if (score == null && suggestionResult.getSuggestion() == null) {
                    return Mono.just(responded);
                }
                boolean newFriction = friction && !responded.isFrictionDetected();
                if (newFriction) {
                    log.info("Low sentiment marks check-in {} as friction: score={}, threshold={}",
                            responded.getId(), score, config.getSilentModeThreshold());
                }
                return checkInStore.transition(responded.getId(), ENRICHABLE, current -> current.toBuilder()
                                .sentimentScore(score)
                                .frictionDetected(current.isFrictionDetected() || friction)
                                .aiSuggestion(suggestionResult.getSuggestion())
                                .aiConfidence(suggestionResult.getConfidence())
                                .updatedAt(clock.instant())
                                .build())
                        .flatMap(enriched -> newFriction && enriched.getStatus() == CheckInStatus.RESPONDED
                                ? fireListeners(enriched, CheckInStatus.RESPONDED).thenReturn(enriched)
                                : Mono.just(enriched))
                        .onErrorResume(CheckInConflictException.class, e -> {
                            log.debug("Check-in changed before enrichment was stored: {}", e.getMessage());
                            return get(responded.getId());
                        });
            });
        });
    }

    private Mono<IEnrichmentResult> requestSuggestion(ICheckIn responded, CheckInSubmission submission) {
        return directory.getAssignment(responded.getTaskId())
                .map(IActiveAssignment::getTaskTitle)
                .onErrorResume(e -> {
                    log.debug("Task title unavailable for suggestion request: taskId={}: {}", responded.getTaskId(), e.toString());
                    return Mono.empty();
                })
                .defaultIfEmpty("")
                .flatMap(title -> enrichmentAdapter.suggest(SuggestionRequest.builder()
                        .checkInId(responded.getId())
                        .taskId(responded.getTaskId())
                        .taskTitle(title.isEmpty() ? null : title)
                        .progressIndicator(submission.getProgressIndicator())
                        .progressNotes(submission.getProgressNotes())
                        .blockersReported(submission.getBlockersReported())
                        .helpNeeded(submission.isHelpNeeded())
                        .build()));
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private static boolean isEscalatable(ICheckIn checkIn) {
        return MISSED_OR_PENDING.contains(checkIn.getStatus())
                || (checkIn.getStatus() == CheckInStatus.RESPONDED && checkIn.isFrictionDetected());
    }

    private Mono<String> resolveEscalationTarget(ICheckIn checkIn, String explicitTarget) {
        if (!isBlank(explicitTarget)) {
            return Mono.just(explicitTarget.trim());
        }
        return configResolver.resolve(checkIn.getOrgId(), checkIn.getTeamId(), checkIn.getUserId(), checkIn.getTaskId())
                .filter(ICheckInConfig::isEscalateToManager)
                .flatMap(config -> directory.getManagerOf(checkIn.getOrgId(), checkIn.getUserId()))
                .switchIfEmpty(Mono.error(() -> new CheckInValidationException(
                        "escalate_to", "is required when no manager can be resolved")));
    }

    private Mono<ICheckIn> afterTransition(ICheckIn checkIn, CheckInStatus from, String actorId,
                                           CheckInActorType actorType, String detail) {
        CheckInTransitionRecord record = CheckInTransitionRecord.of(checkIn, from, actorId, actorType, detail);
        return auditService.record(record)
                .onErrorResume(e -> {
                    log.error("Failed to audit transition: checkInId={}, {} -> {}", checkIn.getId(), from, checkIn.getStatus(), e);
                    return Mono.empty();
                })
                .then(fireListeners(checkIn, from))
                .thenReturn(checkIn);
    }

    private Mono<Void> fireListeners(ICheckIn checkIn, CheckInStatus from) {
        return Flux.fromIterable(listeners)
                .concatMap(listener -> Mono.defer(() -> listener.onTransition(checkIn, from, checkIn.getStatus()))
                        .onErrorResume(e -> {
                            log.error("Transition listener failed: checkInId={}, {} -> {}",
                                    checkIn.getId(), from, checkIn.getStatus(), e);
                            return Mono.empty();
                        }))
                .then();
    }

    private Mono<Void> notifySafely(CheckInNotificationEvent event) {
        return Mono.defer(() -> notificationService.notify(event))
                .doOnNext(result -> {
                    if (!result.isSuccess()) {
                        log.debug("Notification not delivered: type={}, checkInId={}, reason={}",
                                event.getEventType(), event.getCheckInId(), result.errorMessage());
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Notification failed: type={}, checkInId={}: {}",
                            event.getEventType(), event.getCheckInId(), e.toString());
                    return Mono.empty();
                })
                .then();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
