package com.taskpulse.checkin.core.engine.config;

import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import com.taskpulse.checkin.integration.models.config.CheckInConfigModel;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Administration of check-in config records.
 */
public interface ITaskPulseCheckInConfigService {

    /**
     * Validates and stores a new record. Id and timestamps are assigned here.
     */
    Mono<ICheckInConfig> create(CheckInConfigModel config);

    Mono<ICheckInConfig> get(String id);

    Flux<ICheckInConfig> list(String orgId);

    /**
     * Applies the non-null fields of the patch. Scope fields cannot be changed.
     */
    Mono<ICheckInConfig> patch(String id, CheckInConfigPatch patch);

    /**
     * Deletes a team, user or task record. Organization defaults cannot be deleted.
     */
    Mono<Void> delete(String id);
}
