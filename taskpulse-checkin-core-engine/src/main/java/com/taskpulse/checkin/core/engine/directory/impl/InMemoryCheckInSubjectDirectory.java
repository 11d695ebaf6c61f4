package com.taskpulse.checkin.core.engine.directory.impl;

import com.taskpulse.checkin.integration.contract.directory.IActiveAssignment;
import com.taskpulse.checkin.integration.contract.directory.ICheckInSubjectDirectory;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory subject directory for local runs and tests.
 *
 * <pre>{@code
 * InMemoryCheckInSubjectDirectory directory = InMemoryCheckInSubjectDirectory.create(d -> d
 *     .withOrganization("org-1")
 *     .withManager("org-1", "alice", "bob")
 *     .withAssignment(ActiveAssignmentModel.builder()...build()));
 * }</pre>
 */
@Slf4j
public class InMemoryCheckInSubjectDirectory implements ICheckInSubjectDirectory {

    private final Set<String> organizations = ConcurrentHashMap.newKeySet();
    private final Map<String, IActiveAssignment> assignmentsByTask = new ConcurrentHashMap<>();
    private final Map<String, String> managerByUser = new ConcurrentHashMap<>();

    public static InMemoryCheckInSubjectDirectory create() {
        return new InMemoryCheckInSubjectDirectory();
    }

    public static InMemoryCheckInSubjectDirectory create(Consumer<InMemoryCheckInSubjectDirectory> configurator) {
        InMemoryCheckInSubjectDirectory directory = new InMemoryCheckInSubjectDirectory();
        configurator.accept(directory);
        return directory;
    }

    // ========================================================================
    // SETUP
    // ========================================================================

    public InMemoryCheckInSubjectDirectory withOrganization(String orgId) {
        organizations.add(orgId);
        return this;
    }

    public InMemoryCheckInSubjectDirectory withAssignment(IActiveAssignment assignment) {
        organizations.add(assignment.getOrgId());
        assignmentsByTask.put(assignment.getTaskId(), assignment);
        return this;
    }

    public InMemoryCheckInSubjectDirectory withManager(String orgId, String userId, String managerId) {
        organizations.add(orgId);
        managerByUser.put(key(orgId, userId), managerId);
        return this;
    }

    public InMemoryCheckInSubjectDirectory deactivate(String taskId) {
        assignmentsByTask.remove(taskId);
        return this;
    }

    // ========================================================================
    // DIRECTORY
    // ========================================================================

    @Override
    public Flux<IActiveAssignment> listActiveAssignments() {
        return Flux.defer(() -> Flux.fromStream(assignmentsByTask.values().stream()
                .sorted(Comparator.comparing(IActiveAssignment::getTaskId))));
    }

    @Override
    public Mono<IActiveAssignment> getAssignment(String taskId) {
        return Mono.justOrEmpty(assignmentsByTask.get(taskId));
    }

    @Override
    public Mono<String> getManagerOf(String orgId, String userId) {
        return Mono.justOrEmpty(managerByUser.get(key(orgId, userId)));
    }

    @Override
    public Flux<String> getDirectReports(String orgId, String managerId) {
        String prefix = orgId + "/";
        return Flux.defer(() -> Flux.fromStream(managerByUser.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(prefix) && managerId.equals(entry.getValue()))
                .map(entry -> entry.getKey().substring(prefix.length()))
                .sorted()));
    }

    @Override
    public Flux<String> listOrganizations() {
        return Flux.defer(() -> Flux.fromStream(organizations.stream().sorted()));
    }

    private static String key(String orgId, String userId) {
        return orgId + "/" + userId;
    }
}
