package com.taskpulse.checkin.core.exception.codes;

import com.taskpulse.checkin.integration.contract.ITaskPulseErrorInfo;
import com.taskpulse.checkin.integration.enumerations.TaskPulseHttpStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum TaskPulseCheckInErrorCodes implements ITaskPulseErrorInfo {

    VALIDATION_FAILED(
            "TASKPULSE_ERR_0001",
            TaskPulseHttpStatus.BAD_REQUEST,
            "Validation failed: %s",
            "Correct the listed fields and retry"
    ),

    CHECKIN_NOT_FOUND(
            "TASKPULSE_ERR_0002",
            TaskPulseHttpStatus.NOT_FOUND,
            "Check-in not found: %s",
            "Verify the check-in id"
    ),

    CONFIG_NOT_FOUND(
            "TASKPULSE_ERR_0003",
            TaskPulseHttpStatus.NOT_FOUND,
            "Check-in config not found: %s",
            "Verify the config id"
    ),

    TASK_NOT_FOUND(
            "TASKPULSE_ERR_0004",
            TaskPulseHttpStatus.NOT_FOUND,
            "No active assignment for task: %s",
            "Check-ins can only be created for active, assigned tasks"
    ),

    CHECKIN_STATE_CONFLICT(
            "TASKPULSE_ERR_0005",
            TaskPulseHttpStatus.CONFLICT,
            "Check-in %s is %s, expected one of %s",
            "Reload the check-in; another action already changed it"
    ),

    CHECKIN_ALREADY_PENDING(
            "TASKPULSE_ERR_0006",
            TaskPulseHttpStatus.CONFLICT,
            "A pending check-in already exists for task %s and user %s",
            "Respond to or skip the pending check-in first"
    ),

    CHECKIN_NOT_EXPIRED(
            "TASKPULSE_ERR_0011",
            TaskPulseHttpStatus.CONFLICT,
            "Check-in %s is still open until %s",
            "Only check-ins past their response window can expire"
    ),

    CONFIG_SCOPE_CONFLICT(
            "TASKPULSE_ERR_0007",
            TaskPulseHttpStatus.CONFLICT,
            "A check-in config already exists for %s scope %s",
            "Update the existing config instead"
    ),

    CONFIG_DEFAULT_REQUIRED(
            "TASKPULSE_ERR_0008",
            TaskPulseHttpStatus.CONFLICT,
            "The organization default config of %s cannot be removed",
            "Update the organization default instead of deleting it"
    ),

    ENRICHMENT_UNAVAILABLE(
            "TASKPULSE_ERR_0009",
            TaskPulseHttpStatus.SERVICE_UNAVAILABLE,
            "Enrichment call %s failed: %s",
            "Check the enrichment gateway"
    ),

    ORGANIZATION_DEFAULT_MISSING(
            "TASKPULSE_ERR_0010",
            TaskPulseHttpStatus.INTERNAL_SERVER_ERROR,
            "No default check-in config for organization %s",
            "Create an organization default config"
    )

    ;

    private final String errorCode;
    private final TaskPulseHttpStatus httpStatus;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
