package com.taskpulse.checkin.core.engine.audit;

import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInActorType;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One successful status change of a check-in.
 * {@code from} is {@code null} for the creation record.
 */
@Data
@Builder(toBuilder = true)
public class CheckInTransitionRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private final String recordId = UUID.randomUUID().toString();

    private final String checkInId;
    private final String taskId;
    private final String userId;
    private final CheckInStatus from;
    private final CheckInStatus to;
    private final String actor;
    private final CheckInActorType actorType;
    private final String detail;
    private final Instant timestamp;

    public static CheckInTransitionRecord of(ICheckIn checkIn, CheckInStatus from, String actor,
                                             CheckInActorType actorType, String detail) {
        return CheckInTransitionRecord.builder()
                .checkInId(checkIn.getId())
                .taskId(checkIn.getTaskId())
                .userId(checkIn.getUserId())
                .from(from)
                .to(checkIn.getStatus())
                .actor(actor)
                .actorType(actorType)
                .detail(detail)
                .timestamp(checkIn.getUpdatedAt())
                .build();
    }
}
