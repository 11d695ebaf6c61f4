package com.taskpulse.checkin.integration.contract.directory;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Snapshot of an active task and its assignee, as reported by the subject directory.
 */
public interface IActiveAssignment {

    String getOrgId();

    String getTeamId();

    String getTaskId();

    String getTaskTitle();

    String getAssigneeId();

    /**
     * When the task became active; the first check-in is planned from here.
     */
    Instant getActivatedAt();

    /**
     * Zone of the assignee, {@code null} when unknown.
     */
    ZoneId getZone();
}
