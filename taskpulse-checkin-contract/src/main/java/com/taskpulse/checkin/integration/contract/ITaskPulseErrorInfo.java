package com.taskpulse.checkin.integration.contract;

import com.taskpulse.checkin.integration.enumerations.TaskPulseHttpStatus;

public interface ITaskPulseErrorInfo {
    String getErrorCode();
    TaskPulseHttpStatus getHttpStatus();
    String getErrorTemplate();
    String getResolutionTemplate();
}
