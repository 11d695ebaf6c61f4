package com.taskpulse.checkin.core.engine.config.impl;

import com.taskpulse.checkin.core.engine.config.CheckInConfigPatch;
import com.taskpulse.checkin.core.engine.config.CheckInConfigRules;
import com.taskpulse.checkin.core.engine.config.ICheckInConfigStore;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigService;
import com.taskpulse.checkin.core.exception.CheckInConflictException;
import com.taskpulse.checkin.core.exception.CheckInNotFoundException;
import com.taskpulse.checkin.core.exception.codes.TaskPulseCheckInErrorCodes;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.enumerations.CheckInConfigScope;
import com.taskpulse.checkin.integration.models.config.CheckInConfigModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
public class TaskPulseCheckInConfigServiceImpl implements ITaskPulseCheckInConfigService {

    private final ICheckInConfigStore configStore;
    private final Clock clock;

    @Override
    public Mono<ICheckInConfig> create(CheckInConfigModel config) {
        return Mono.fromCallable(() -> {
                    CheckInConfigRules.validate(config);
                    Instant now = clock.instant();
                    return config.toBuilder()
                            .id(UUID.randomUUID().toString())
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                })
                .flatMap(configStore::insert)
                .doOnNext(created -> log.info("Created check-in config: id={}, orgId={}, scope={}",
                        created.getId(), created.getOrgId(), created.getScope()));
    }

    @Override
    public Mono<ICheckInConfig> get(String id) {
        return configStore.findById(id)
                .switchIfEmpty(Mono.error(() -> CheckInNotFoundException.config(id)));
    }

    @Override
    public Flux<ICheckInConfig> list(String orgId) {
        return configStore.listByOrg(orgId);
    }

    @Override
    public Mono<ICheckInConfig> patch(String id, CheckInConfigPatch patch) {
        return get(id)
                .map(current -> {
                    CheckInConfigModel updated = patch.applyTo(toModel(current))
                            .withUpdatedAt(clock.instant());
                    CheckInConfigRules.validate(updated);
                    return updated;
                })
                .flatMap(configStore::replace)
                .doOnNext(updated -> log.info("Updated check-in config: id={}", id));
    }

    @Override
    public Mono<Void> delete(String id) {
        return get(id)
                .flatMap(config -> {
                    if (config.getScope() == CheckInConfigScope.ORGANIZATION) {
                        return Mono.error(new CheckInConflictException(
                                TaskPulseCheckInErrorCodes.CONFIG_DEFAULT_REQUIRED, config.getOrgId()));
                    }
                    return configStore.delete(id);
                })
                .doOnNext(deleted -> log.info("Deleted check-in config: id={}", id))
                .then();
    }

    private static CheckInConfigModel toModel(ICheckInConfig config) {
        if (config instanceof CheckInConfigModel) {
            return (CheckInConfigModel) config;
        }
        return CheckInConfigModel.builder()
                .id(config.getId())
                .orgId(config.getOrgId())
                .teamId(config.getTeamId())
                .userId(config.getUserId())
                .taskId(config.getTaskId())
                .intervalHours(config.getIntervalHours())
                .enabled(config.isEnabled())
                .silentModeThreshold(config.getSilentModeThreshold())
                .maxDailyCheckins(config.getMaxDailyCheckins())
                .workStartHour(config.getWorkStartHour())
                .workEndHour(config.getWorkEndHour())
                .respectTimezone(config.isRespectTimezone())
                .excludedDays(config.getExcludedDays())
                .autoEscalateAfterMissed(config.getAutoEscalateAfterMissed())
                .escalateToManager(config.isEscalateToManager())
                .aiSuggestionsEnabled(config.isAiSuggestionsEnabled())
                .aiSentimentAnalysis(config.isAiSentimentAnalysis())
                .responseWindowMinutes(config.getResponseWindowMinutes())
                .createdAt(config.getCreatedAt())
                .updatedAt(config.getUpdatedAt())
                .build();
    }
}
