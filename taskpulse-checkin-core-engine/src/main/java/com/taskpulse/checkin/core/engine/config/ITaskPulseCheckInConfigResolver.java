package com.taskpulse.checkin.core.engine.config;

import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Selects the effective check-in config for a subject.
 *
 * <p>Resolution order is task, user, team, organization default. The first record
 * found wins as a whole. A missing organization default is a policy error.</p>
 */
public interface ITaskPulseCheckInConfigResolver {

    /**
     * Resolves the effective config. Any of {@code teamId}, {@code userId} and
     * {@code taskId} may be {@code null}.
     *
     * @throws com.taskpulse.checkin.core.exception.CheckInPolicyException (as error signal)
     *         when the organization has no default config
     */
    Mono<ICheckInConfig> resolve(String orgId, String teamId, String userId, String taskId);

    /**
     * Verifies every given organization has a default config. Errors with a policy
     * exception naming the first organization that does not.
     */
    Mono<Void> verifyOrganizationDefaults(Flux<String> orgIds);
}
