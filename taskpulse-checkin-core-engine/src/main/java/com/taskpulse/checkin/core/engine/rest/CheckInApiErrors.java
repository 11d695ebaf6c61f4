package com.taskpulse.checkin.core.engine.rest;

import com.taskpulse.checkin.core.engine.rest.dto.ApiResponse;
import com.taskpulse.checkin.core.exception.CheckInPolicyException;
import com.taskpulse.checkin.core.exception.CheckInValidationException;
import com.taskpulse.checkin.core.exception.TaskPulseCheckInException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Translates engine errors into API responses. Engine exceptions carry their own HTTP
 * status; anything else is logged and reported as an internal error.
 */
@Slf4j
final class CheckInApiErrors {

    static final String INTERNAL_ERROR = "TASKPULSE_ERR_0000";

    private CheckInApiErrors() {
    }

    static <T> Mono<ResponseEntity<ApiResponse<T>>> toResponse(Throwable error, String operation) {
        if (error instanceof CheckInValidationException) {
            CheckInValidationException validation = (CheckInValidationException) error;
            log.debug("{} rejected: {}", operation, validation.getFieldErrors());
            return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.error(validation.getMessage(), validation.getErrorCode(), validation.getFieldErrors())));
        }
        if (error instanceof CheckInPolicyException) {
            log.error("{} failed on engine policy", operation, error);
        }
        if (error instanceof TaskPulseCheckInException) {
            TaskPulseCheckInException engineError = (TaskPulseCheckInException) error;
            log.debug("{} failed: {}", operation, engineError.getMessage());
            return Mono.just(ResponseEntity.status(engineError.getErrorInfo().getHttpStatus().getCode())
                    .body(ApiResponse.error(engineError.getMessage(), engineError.getErrorCode())));
        }
        log.error("{} failed unexpectedly", operation, error);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName(),
                        INTERNAL_ERROR)));
    }
}
