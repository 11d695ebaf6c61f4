package com.taskpulse.checkin.core.exception;

import com.taskpulse.checkin.core.exception.codes.TaskPulseCheckInErrorCodes;

public class CheckInNotFoundException extends TaskPulseCheckInException {

    public CheckInNotFoundException(TaskPulseCheckInErrorCodes code, String id) {
        super(code, id);
    }

    public static CheckInNotFoundException checkIn(String id) {
        return new CheckInNotFoundException(TaskPulseCheckInErrorCodes.CHECKIN_NOT_FOUND, id);
    }

    public static CheckInNotFoundException config(String id) {
        return new CheckInNotFoundException(TaskPulseCheckInErrorCodes.CONFIG_NOT_FOUND, id);
    }

    public static CheckInNotFoundException task(String taskId) {
        return new CheckInNotFoundException(TaskPulseCheckInErrorCodes.TASK_NOT_FOUND, taskId);
    }
}
