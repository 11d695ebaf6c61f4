package com.taskpulse.checkin.core.engine.rest;

import com.taskpulse.checkin.core.engine.audit.ITaskPulseCheckInAuditService;
import com.taskpulse.checkin.core.engine.config.CheckInEngineSettings;
import com.taskpulse.checkin.core.engine.lifecycle.CreateCheckInCommand;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.lifecycle.impl.TaskPulseCheckInLifecycleServiceImpl;
import com.taskpulse.checkin.core.engine.rest.dto.ApiResponse;
import com.taskpulse.checkin.core.engine.rest.dto.CheckInDto;
import com.taskpulse.checkin.core.engine.rest.dto.CreateCheckInRequest;
import com.taskpulse.checkin.core.engine.rest.dto.EscalateRequest;
import com.taskpulse.checkin.core.engine.rest.dto.FeedDto;
import com.taskpulse.checkin.core.engine.rest.dto.PagedResponse;
import com.taskpulse.checkin.core.engine.rest.dto.RespondRequest;
import com.taskpulse.checkin.core.engine.rest.dto.SkipRequest;
import com.taskpulse.checkin.core.engine.rest.dto.StatisticsDto;
import com.taskpulse.checkin.core.engine.statistics.ITaskPulseCheckInStatisticsService;
import com.taskpulse.checkin.core.engine.statistics.StatisticsScope;
import com.taskpulse.checkin.core.engine.store.CheckInQuery;
import com.taskpulse.checkin.core.engine.validation.CheckInRequestValidator;
import com.taskpulse.checkin.core.exception.CheckInNotFoundException;
import com.taskpulse.checkin.core.exception.CheckInValidationException;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInActorType;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for check-ins.
 *
 * <h2>API Endpoints</h2>
 * <table border="1">
 *   <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 *   <tr><td>GET</td><td>/api/v1/checkins</td><td>List check-ins of the caller's organization</td></tr>
 *   <tr><td>GET</td><td>/api/v1/checkins/pending</td><td>Pending check-ins of the caller</td></tr>
 *   <tr><td>GET</td><td>/api/v1/checkins/{id}</td><td>One check-in with its transition count</td></tr>
 *   <tr><td>POST</td><td>/api/v1/checkins</td><td>Open a check-in on request</td></tr>
 *   <tr><td>POST</td><td>/api/v1/checkins/{id}/respond</td><td>Submit a progress update</td></tr>
 *   <tr><td>POST</td><td>/api/v1/checkins/{id}/skip</td><td>Decline to respond</td></tr>
 *   <tr><td>POST</td><td>/api/v1/checkins/{id}/escalate</td><td>Route to a manager</td></tr>
 *   <tr><td>GET</td><td>/api/v1/checkins/statistics</td><td>Response metrics</td></tr>
 *   <tr><td>GET</td><td>/api/v1/checkins/feed</td><td>Manager "needs attention" feed</td></tr>
 * </table>
 *
 * <p>Callers identify themselves with the {@code X-Org-Id} and {@code X-User-Id} headers.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/checkins")
@RequiredArgsConstructor
public class CheckInController {

    public static final String ORG_HEADER = "X-Org-Id";
    public static final String USER_HEADER = "X-User-Id";

    static final int MAX_STATISTICS_DAYS = 365;

    private final ITaskPulseCheckInLifecycleService lifecycleService;
    private final ITaskPulseCheckInStatisticsService statisticsService;
    private final ITaskPulseCheckInAuditService auditService;
    private final CheckInRequestValidator requestValidator;
    private final CheckInEngineSettings settings;

    // ========================================================================
    // QUERY ENDPOINTS
    // ========================================================================

    /**
     * Lists check-ins newest first. {@code status} accepts a comma-separated list.
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<PagedResponse<CheckInDto>>>> listCheckIns(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestParam(required = false) String status,
            @RequestParam(name = "task_id", required = false) String taskId,
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(name = "team_id", required = false) String teamId,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(required = false) Integer limit) {

        log.debug("Listing check-ins: orgId={}, status={}, taskId={}, userId={}, teamId={}, skip={}, limit={}",
                orgId, status, taskId, userId, teamId, skip, limit);

        return Mono.fromCallable(() -> CheckInQuery.builder()
                        .orgId(orgId)
                        .statuses(parseStatuses(status))
                        .taskId(taskId)
                        .userId(userId)
                        .teamId(teamId)
                        .build())
                .flatMap(filter -> {
                    int pageSkip = Math.max(0, skip);
                    int pageLimit = settings.clampLimit(limit);
                    return lifecycleService.list(filter.withSkip(pageSkip).withLimit(pageLimit))
                            .map(CheckInDto::fromEntity)
                            .collectList()
                            .zipWith(lifecycleService.count(filter))
                            .map(tuple -> ResponseEntity.ok(ApiResponse.success(
                                    PagedResponse.of(tuple.getT1(), tuple.getT2(), pageSkip, pageLimit))));
                })
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "List check-ins"));
    }

    @GetMapping(value = "/pending", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<List<CheckInDto>>>> getPendingCheckIns(
            @RequestHeader(USER_HEADER) String userId) {

        log.debug("Getting pending check-ins: userId={}", userId);

        return lifecycleService.listPending(userId)
                .map(CheckInDto::fromEntity)
                .collectList()
                .map(checkIns -> ResponseEntity.ok(ApiResponse.success(checkIns)))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Get pending check-ins"));
    }

    @GetMapping(value = "/{checkInId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<CheckInDto>>> getCheckIn(
            @PathVariable String checkInId,
            @RequestHeader(ORG_HEADER) String orgId) {

        log.debug("Getting check-in: orgId={}, checkInId={}", orgId, checkInId);

        return ownedCheckIn(orgId, checkInId)
                .zipWith(auditService.countHistory(checkInId))
                .map(tuple -> {
                    CheckInDto dto = CheckInDto.fromEntity(tuple.getT1());
                    dto.setTransitionCount(tuple.getT2());
                    return ResponseEntity.ok(ApiResponse.success(dto));
                })
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Get check-in " + checkInId));
    }

    // ========================================================================
    // ACTION ENDPOINTS
    // ========================================================================

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE, consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<CheckInDto>>> createCheckIn(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(value = USER_HEADER, required = false) String actorId,
            @RequestBody(required = false) CreateCheckInRequest request) {

        log.info("Creating check-in: orgId={}, request={}", orgId, request);

        return requestValidator.validate(request)
                .flatMap(valid -> {
                    CreateCheckInCommand.CreateCheckInCommandBuilder command = CreateCheckInCommand.builder()
                            .orgId(orgId)
                            .taskId(valid.getTaskId())
                            .userId(valid.getUserId())
                            .actorId(actorId != null ? actorId : TaskPulseCheckInLifecycleServiceImpl.SYSTEM_ACTOR)
                            .actorType(actorId != null ? CheckInActorType.USER : CheckInActorType.SYSTEM);
                    if (valid.getTrigger() != null) {
                        command.trigger(valid.getTrigger());
                    }
                    return lifecycleService.create(command.build());
                })
                .map(created -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiResponse.success(CheckInDto.fromEntity(created))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Create check-in"));
    }

    /**
     * Submits a progress update. Enrichment failures never fail this call.
     */
    @PostMapping(value = "/{checkInId}/respond", produces = MediaType.APPLICATION_JSON_VALUE,
            consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<CheckInDto>>> respond(
            @PathVariable String checkInId,
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(USER_HEADER) String userId,
            @RequestBody(required = false) RespondRequest request) {

        log.info("Responding to check-in: orgId={}, checkInId={}, userId={}", orgId, checkInId, userId);

        return requestValidator.validate(request)
                .flatMap(valid -> ownedCheckIn(orgId, checkInId)
                        .flatMap(owned -> lifecycleService.respond(checkInId, userId, valid.toSubmission())))
                .map(checkIn -> ResponseEntity.ok(ApiResponse.success(CheckInDto.fromEntity(checkIn))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Respond to check-in " + checkInId));
    }

    @PostMapping(value = "/{checkInId}/skip", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<CheckInDto>>> skip(
            @PathVariable String checkInId,
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(USER_HEADER) String userId,
            @RequestBody(required = false) SkipRequest request) {

        SkipRequest body = request != null ? request : new SkipRequest();
        log.info("Skipping check-in: orgId={}, checkInId={}, userId={}, reason={}", orgId, checkInId, userId, body.getReason());

        return requestValidator.validate(body)
                .flatMap(valid -> ownedCheckIn(orgId, checkInId)
                        .flatMap(owned -> lifecycleService.skip(checkInId, userId, valid.getReason())))
                .map(checkIn -> ResponseEntity.ok(ApiResponse.success(CheckInDto.fromEntity(checkIn))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Skip check-in " + checkInId));
    }

    @PostMapping(value = "/{checkInId}/escalate", produces = MediaType.APPLICATION_JSON_VALUE,
            consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<CheckInDto>>> escalate(
            @PathVariable String checkInId,
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(USER_HEADER) String userId,
            @RequestBody(required = false) EscalateRequest request) {

        log.info("Escalating check-in: orgId={}, checkInId={}, userId={}", orgId, checkInId, userId);

        return requestValidator.validate(request)
                .flatMap(valid -> ownedCheckIn(orgId, checkInId)
                        .flatMap(owned -> lifecycleService.escalate(checkInId, valid.getReason(), valid.getEscalateTo(),
                                userId, CheckInActorType.USER)))
                .map(checkIn -> ResponseEntity.ok(ApiResponse.success(CheckInDto.fromEntity(checkIn))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Escalate check-in " + checkInId));
    }

    // ========================================================================
    // STATISTICS ENDPOINTS
    // ========================================================================

    @GetMapping(value = "/statistics", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<StatisticsDto>>> getStatistics(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestParam(name = "team_id", required = false) String teamId,
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(defaultValue = "30") int days) {

        log.debug("Getting check-in statistics: orgId={}, teamId={}, userId={}, days={}", orgId, teamId, userId, days);

        if (days < 1 || days > MAX_STATISTICS_DAYS) {
            return CheckInApiErrors.toResponse(
                    new CheckInValidationException("days", "must be between 1 and " + MAX_STATISTICS_DAYS),
                    "Get statistics");
        }

        StatisticsScope scope = StatisticsScope.builder()
                .orgId(orgId)
                .teamId(teamId)
                .userId(userId)
                .build();
        return statisticsService.getStatistics(scope, days)
                .map(statistics -> ResponseEntity.ok(ApiResponse.success(StatisticsDto.from(statistics))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Get statistics"));
    }

    @GetMapping(value = "/feed", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<FeedDto>>> getManagerFeed(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestParam(name = "manager_id", required = false) String managerId,
            @RequestHeader(value = USER_HEADER, required = false) String callerId,
            @RequestParam(name = "needs_attention", defaultValue = "false") boolean needsAttentionOnly,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(required = false) Integer limit) {

        String manager = managerId != null && !managerId.isBlank() ? managerId : callerId;
        log.debug("Getting manager feed: orgId={}, managerId={}, needsAttention={}", orgId, manager, needsAttentionOnly);

        if (manager == null || manager.isBlank()) {
            return CheckInApiErrors.toResponse(new CheckInValidationException("manager_id", "is required"), "Get manager feed");
        }

        return statisticsService.getManagerFeed(orgId, manager, needsAttentionOnly, Math.max(0, skip), settings.clampLimit(limit))
                .map(feed -> ResponseEntity.ok(ApiResponse.success(FeedDto.from(feed))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Get manager feed"));
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    /**
     * Check-ins of another organization are reported as missing.
     */
    private Mono<ICheckIn> ownedCheckIn(String orgId, String checkInId) {
        return lifecycleService.get(checkInId)
                .filter(checkIn -> orgId.equals(checkIn.getOrgId()))
                .switchIfEmpty(Mono.error(() -> CheckInNotFoundException.checkIn(checkInId)));
    }

    private static EnumSet<CheckInStatus> parseStatuses(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        EnumSet<CheckInStatus> statuses = EnumSet.noneOf(CheckInStatus.class);
        for (String value : status.split(",")) {
            if (value.isBlank()) {
                continue;
            }
            try {
                statuses.add(CheckInStatus.fromJson(value));
            } catch (IllegalArgumentException e) {
                throw new CheckInValidationException("status", "must be one of " + Arrays.stream(CheckInStatus.values())
                        .map(CheckInStatus::toJson)
                        .collect(Collectors.joining(", ")));
            }
        }
        return statuses;
    }
}
