package com.taskpulse.checkin.integration.contract.directory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only view of task, user and team management that the check-in engine depends on.
 * Implementations live outside the engine.
 */
public interface ICheckInSubjectDirectory {

    /**
     * All tasks that are active and have an assignee.
     */
    Flux<IActiveAssignment> listActiveAssignments();

    /**
     * The active assignment of a task, empty when the task is unknown or inactive.
     */
    Mono<IActiveAssignment> getAssignment(String taskId);

    /**
     * The manager of a user, empty when none is known.
     */
    Mono<String> getManagerOf(String orgId, String userId);

    Flux<String> getDirectReports(String orgId, String managerId);

    Flux<String> listOrganizations();
}
