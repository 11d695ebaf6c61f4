package com.taskpulse.checkin.core.engine.rest;

import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigService;
import com.taskpulse.checkin.core.engine.rest.dto.ApiResponse;
import com.taskpulse.checkin.core.engine.rest.dto.CheckInConfigDto;
import com.taskpulse.checkin.core.engine.rest.dto.CheckInConfigPatchRequest;
import com.taskpulse.checkin.core.engine.rest.dto.CheckInConfigRequest;
import com.taskpulse.checkin.core.engine.validation.CheckInRequestValidator;
import com.taskpulse.checkin.core.exception.CheckInNotFoundException;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Administration of check-in config records of the caller's organization.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/checkins/config")
@RequiredArgsConstructor
public class CheckInConfigController {

    private final ITaskPulseCheckInConfigService configService;
    private final CheckInRequestValidator requestValidator;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<List<CheckInConfigDto>>>> listConfigs(
            @RequestHeader(CheckInController.ORG_HEADER) String orgId) {

        log.debug("Listing check-in configs: orgId={}", orgId);

        return configService.list(orgId)
                .map(CheckInConfigDto::fromEntity)
                .collectList()
                .map(configs -> ResponseEntity.ok(ApiResponse.success(configs)))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "List configs"));
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE, consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<CheckInConfigDto>>> createConfig(
            @RequestHeader(CheckInController.ORG_HEADER) String orgId,
            @RequestBody(required = false) CheckInConfigRequest request) {

        log.info("Creating check-in config: orgId={}", orgId);

        return requestValidator.validate(request)
                .flatMap(valid -> configService.create(valid.toModel(orgId)))
                .map(created -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiResponse.success(CheckInConfigDto.fromEntity(created))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Create config"));
    }

    @GetMapping(value = "/{configId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<CheckInConfigDto>>> getConfig(
            @RequestHeader(CheckInController.ORG_HEADER) String orgId,
            @PathVariable String configId) {

        return ownedConfig(orgId, configId)
                .map(config -> ResponseEntity.ok(ApiResponse.success(CheckInConfigDto.fromEntity(config))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Get config " + configId));
    }

    /**
     * Partial update. Scope fields are not part of the payload and cannot change.
     */
    @PatchMapping(value = "/{configId}", produces = MediaType.APPLICATION_JSON_VALUE,
            consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<CheckInConfigDto>>> patchConfig(
            @RequestHeader(CheckInController.ORG_HEADER) String orgId,
            @PathVariable String configId,
            @RequestBody(required = false) CheckInConfigPatchRequest request) {

        log.info("Updating check-in config: orgId={}, configId={}", orgId, configId);

        return requestValidator.validate(request)
                .flatMap(valid -> ownedConfig(orgId, configId)
                        .flatMap(config -> configService.patch(configId, valid.toPatch())))
                .map(updated -> ResponseEntity.ok(ApiResponse.success(CheckInConfigDto.fromEntity(updated))))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Update config " + configId));
    }

    @DeleteMapping(value = "/{configId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<Void>>> deleteConfig(
            @RequestHeader(CheckInController.ORG_HEADER) String orgId,
            @PathVariable String configId) {

        log.info("Deleting check-in config: orgId={}, configId={}", orgId, configId);

        return ownedConfig(orgId, configId)
                .flatMap(config -> configService.delete(configId))
                .then(Mono.fromCallable(() -> ResponseEntity.ok(ApiResponse.<Void>success())))
                .onErrorResume(e -> CheckInApiErrors.toResponse(e, "Delete config " + configId));
    }

    private Mono<ICheckInConfig> ownedConfig(String orgId, String configId) {
        return configService.get(configId)
                .filter(config -> orgId.equals(config.getOrgId()))
                .switchIfEmpty(Mono.error(() -> CheckInNotFoundException.config(configId)));
    }
}
