package com.taskpulse.checkin.core.exception;

import com.taskpulse.checkin.core.exception.codes.TaskPulseCheckInErrorCodes;

/**
 * The enrichment gateway failed or timed out. Never surfaced to API callers.
 */
public class EnrichmentDependencyException extends TaskPulseCheckInException {

    public EnrichmentDependencyException(String operation, Throwable cause) {
        super(TaskPulseCheckInErrorCodes.ENRICHMENT_UNAVAILABLE, cause, operation,
                cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    }
}
