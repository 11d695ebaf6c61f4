package com.taskpulse.checkin.core.engine.lifecycle;

import com.taskpulse.checkin.integration.enumerations.CheckInActorType;
import com.taskpulse.checkin.integration.enumerations.CheckInTrigger;
import lombok.Builder;
import lombok.Data;

/**
 * Request to open a check-in outside the scheduler.
 */
@Data
@Builder
public class CreateCheckInCommand {

    /**
     * Organization of the caller; must match the task's organization when set.
     */
    private final String orgId;

    private final String taskId;

    /**
     * Subject of the check-in. Defaults to the task's assignee.
     */
    private final String userId;

    @Builder.Default
    private final CheckInTrigger trigger = CheckInTrigger.MANUAL;

    private final String actorId;

    @Builder.Default
    private final CheckInActorType actorType = CheckInActorType.USER;
}
