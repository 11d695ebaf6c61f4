package com.taskpulse.checkin.core.exception;

import com.taskpulse.checkin.integration.contract.ITaskPulseErrorInfo;
import lombok.Getter;

/**
 * Root of all errors raised by the check-in engine.
 */
@Getter
public class TaskPulseCheckInException extends RuntimeException {

    private final ITaskPulseErrorInfo errorInfo;

    public TaskPulseCheckInException(ITaskPulseErrorInfo errorInfo, Object... args) {
        super(String.format(errorInfo.getErrorTemplate(), args));
        this.errorInfo = errorInfo;
    }

    public TaskPulseCheckInException(ITaskPulseErrorInfo errorInfo, Throwable cause, Object... args) {
        super(String.format(errorInfo.getErrorTemplate(), args), cause);
        this.errorInfo = errorInfo;
    }

    public String getErrorCode() {
        return errorInfo.getErrorCode();
    }
}
