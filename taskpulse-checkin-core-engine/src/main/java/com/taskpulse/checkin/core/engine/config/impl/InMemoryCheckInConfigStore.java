package com.taskpulse.checkin.core.engine.config.impl;

import com.taskpulse.checkin.core.engine.config.ICheckInConfigStore;
import com.taskpulse.checkin.core.exception.CheckInConflictException;
import com.taskpulse.checkin.core.exception.CheckInNotFoundException;
import com.taskpulse.checkin.core.exception.codes.TaskPulseCheckInErrorCodes;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.enumerations.CheckInConfigScope;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory config store. A scope index guarantees one record per scope.
 */
@Slf4j
public class InMemoryCheckInConfigStore implements ICheckInConfigStore {

    private final Map<String, ICheckInConfig> configsById = new ConcurrentHashMap<>();
    private final Map<String, String> idsByScope = new ConcurrentHashMap<>();

    @Override
    public Mono<ICheckInConfig> insert(ICheckInConfig config) {
        return Mono.fromCallable(() -> {
            String scopeKey = scopeKey(config);
            String existing = idsByScope.putIfAbsent(scopeKey, config.getId());
            if (existing != null) {
                throw new CheckInConflictException(TaskPulseCheckInErrorCodes.CONFIG_SCOPE_CONFLICT,
                        config.getScope(), scopeKey);
            }
            configsById.put(config.getId(), config);
            log.debug("Stored check-in config: id={}, scope={}", config.getId(), scopeKey);
            return config;
        });
    }

    @Override
    public Mono<ICheckInConfig> replace(ICheckInConfig config) {
        return Mono.fromCallable(() -> {
            ICheckInConfig updated = configsById.computeIfPresent(config.getId(), (id, current) -> {
                if (!scopeKey(current).equals(scopeKey(config))) {
                    throw new IllegalArgumentException("Config scope cannot change: " + id);
                }
                return config;
            });
            if (updated == null) {
                throw CheckInNotFoundException.config(config.getId());
            }
            return updated;
        });
    }

    @Override
    public Mono<ICheckInConfig> findById(String id) {
        return Mono.justOrEmpty(configsById.get(id));
    }

    @Override
    public Mono<ICheckInConfig> findByScope(String orgId, CheckInConfigScope scope, String scopeId) {
        return Mono.defer(() -> {
            String id = idsByScope.get(scopeKey(orgId, scope, scopeId));
            return id == null ? Mono.empty() : Mono.justOrEmpty(configsById.get(id));
        });
    }

    @Override
    public Flux<ICheckInConfig> listByOrg(String orgId) {
        return Flux.defer(() -> Flux.fromStream(configsById.values().stream()
                .filter(config -> orgId.equals(config.getOrgId()))
                .sorted(Comparator.comparing((ICheckInConfig c) -> c.getScope().ordinal())
                        .thenComparing(ICheckInConfig::getId))));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return Mono.fromCallable(() -> {
            ICheckInConfig removed = configsById.remove(id);
            if (removed == null) {
                return false;
            }
            idsByScope.remove(scopeKey(removed), id);
            return true;
        });
    }

    private static String scopeKey(ICheckInConfig config) {
        CheckInConfigScope scope = config.getScope();
        String scopeId;
        switch (scope) {
            case TASK:
                scopeId = config.getTaskId();
                break;
            case USER:
                scopeId = config.getUserId();
                break;
            case TEAM:
                scopeId = config.getTeamId();
                break;
            default:
                scopeId = null;
        }
        return scopeKey(config.getOrgId(), scope, scopeId);
    }

    private static String scopeKey(String orgId, CheckInConfigScope scope, String scopeId) {
        return scope == CheckInConfigScope.ORGANIZATION
                ? orgId + "/" + scope
                : orgId + "/" + scope + "/" + scopeId;
    }
}
