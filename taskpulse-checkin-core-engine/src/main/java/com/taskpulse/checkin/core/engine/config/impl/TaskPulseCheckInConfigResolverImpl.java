package com.taskpulse.checkin.core.engine.config.impl;

import com.taskpulse.checkin.core.engine.config.ICheckInConfigStore;
import com.taskpulse.checkin.core.engine.config.ITaskPulseCheckInConfigResolver;
import com.taskpulse.checkin.core.exception.CheckInPolicyException;
import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.enumerations.CheckInConfigScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RequiredArgsConstructor
public class TaskPulseCheckInConfigResolverImpl implements ITaskPulseCheckInConfigResolver {

    private final ICheckInConfigStore configStore;

    @Override
    public Mono<ICheckInConfig> resolve(String orgId, String teamId, String userId, String taskId) {
        return lookup(orgId, CheckInConfigScope.TASK, taskId)
                .switchIfEmpty(Mono.defer(() -> lookup(orgId, CheckInConfigScope.USER, userId)))
                .switchIfEmpty(Mono.defer(() -> lookup(orgId, CheckInConfigScope.TEAM, teamId)))
                .switchIfEmpty(Mono.defer(() -> configStore.findByScope(orgId, CheckInConfigScope.ORGANIZATION, null)))
                .switchIfEmpty(Mono.defer(() -> {
                    log.error("No default check-in config for organization: orgId={}", orgId);
                    return Mono.error(CheckInPolicyException.missingDefault(orgId));
                }));
    }

    @Override
    public Mono<Void> verifyOrganizationDefaults(Flux<String> orgIds) {
        return orgIds
                .concatMap(orgId -> configStore.findByScope(orgId, CheckInConfigScope.ORGANIZATION, null)
                        .switchIfEmpty(Mono.error(CheckInPolicyException.missingDefault(orgId))))
                .then();
    }

    private Mono<ICheckInConfig> lookup(String orgId, CheckInConfigScope scope, String scopeId) {
        if (scopeId == null) {
            return Mono.empty();
        }
        return configStore.findByScope(orgId, scope, scopeId);
    }
}
