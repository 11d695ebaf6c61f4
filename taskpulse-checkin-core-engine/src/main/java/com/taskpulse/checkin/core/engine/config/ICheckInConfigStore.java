package com.taskpulse.checkin.core.engine.config;

import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.enumerations.CheckInConfigScope;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence of check-in config records. At most one record exists per scope.
 */
public interface ICheckInConfigStore {

    /**
     * Inserts a new record; fails with a conflict when its scope is already configured.
     */
    Mono<ICheckInConfig> insert(ICheckInConfig config);

    /**
     * Replaces an existing record with the same id. The scope must not change.
     */
    Mono<ICheckInConfig> replace(ICheckInConfig config);

    Mono<ICheckInConfig> findById(String id);

    /**
     * Finds the record of one scope. {@code scopeId} is ignored for the organization scope.
     */
    Mono<ICheckInConfig> findByScope(String orgId, CheckInConfigScope scope, String scopeId);

    Flux<ICheckInConfig> listByOrg(String orgId);

    Mono<Boolean> delete(String id);
}
