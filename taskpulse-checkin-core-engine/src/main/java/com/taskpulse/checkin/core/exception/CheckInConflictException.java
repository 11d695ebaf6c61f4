package com.taskpulse.checkin.core.exception;

import com.taskpulse.checkin.core.exception.codes.TaskPulseCheckInErrorCodes;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;

import java.time.Instant;
import java.util.Set;

/**
 * The requested change does not fit the current state, typically because a
 * concurrent transition landed first. Nothing was modified.
 */
public class CheckInConflictException extends TaskPulseCheckInException {

    public CheckInConflictException(TaskPulseCheckInErrorCodes code, Object... args) {
        super(code, args);
    }

    public static CheckInConflictException state(String checkInId, CheckInStatus actual, Set<CheckInStatus> expected) {
        return new CheckInConflictException(TaskPulseCheckInErrorCodes.CHECKIN_STATE_CONFLICT, checkInId, actual, expected);
    }

    public static CheckInConflictException notExpired(String checkInId, Instant expiresAt) {
        return new CheckInConflictException(TaskPulseCheckInErrorCodes.CHECKIN_NOT_EXPIRED, checkInId, expiresAt);
    }

    public static CheckInConflictException alreadyPending(String taskId, String userId) {
        return new CheckInConflictException(TaskPulseCheckInErrorCodes.CHECKIN_ALREADY_PENDING, taskId, userId);
    }
}
