package com.taskpulse.checkin.integration.models.directory;

import com.taskpulse.checkin.integration.contract.directory.IActiveAssignment;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;
import java.time.ZoneId;

@Data
@Builder(toBuilder = true)
@With
public class ActiveAssignmentModel implements IActiveAssignment {
    private final String orgId;
    private final String teamId;
    private final String taskId;
    private final String taskTitle;
    private final String assigneeId;
    private final Instant activatedAt;
    private final ZoneId zone;
}
