package com.taskpulse.checkin.core.exception;

import com.taskpulse.checkin.core.exception.codes.TaskPulseCheckInErrorCodes;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input rejected before any state was touched. Carries one message per offending field.
 */
@Getter
public class CheckInValidationException extends TaskPulseCheckInException {

    private final Map<String, String> fieldErrors;

    public CheckInValidationException(Map<String, String> fieldErrors) {
        super(TaskPulseCheckInErrorCodes.VALIDATION_FAILED, describe(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public CheckInValidationException(String field, String message) {
        this(Map.of(field, message));
    }

    private static String describe(Map<String, String> fieldErrors) {
        StringBuilder sb = new StringBuilder();
        fieldErrors.forEach((field, message) -> {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(field).append(' ').append(message);
        });
        return sb.toString();
    }
}
