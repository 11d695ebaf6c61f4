package com.taskpulse.checkin.core.exception;

import com.taskpulse.checkin.core.exception.codes.TaskPulseCheckInErrorCodes;

/**
 * Engine policy is misconfigured, for example an organization without a default config.
 */
public class CheckInPolicyException extends TaskPulseCheckInException {

    public CheckInPolicyException(TaskPulseCheckInErrorCodes code, Object... args) {
        super(code, args);
    }

    public static CheckInPolicyException missingDefault(String orgId) {
        return new CheckInPolicyException(TaskPulseCheckInErrorCodes.ORGANIZATION_DEFAULT_MISSING, orgId);
    }
}
