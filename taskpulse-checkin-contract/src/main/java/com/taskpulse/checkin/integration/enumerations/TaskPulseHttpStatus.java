package com.taskpulse.checkin.integration.enumerations;

/**
 * HTTP status codes the engine maps its errors onto.
 */
public enum TaskPulseHttpStatus {

    BAD_REQUEST(400),
    NOT_FOUND(404),
    CONFLICT(409),
    INTERNAL_SERVER_ERROR(500),
    SERVICE_UNAVAILABLE(503);

    private final int code;

    TaskPulseHttpStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
