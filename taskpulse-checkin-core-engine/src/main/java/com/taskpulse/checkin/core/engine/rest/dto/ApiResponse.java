package com.taskpulse.checkin.core.engine.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Envelope of every check-in API response.
 *
 * @param <T> the type of data in the response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApiResponse<T> {

    /**
     * {@code false} when the request was rejected or failed.
     */
    private boolean success;

    /**
     * Payload of a successful call; absent on errors and on deletes.
     */
    private T data;

    /**
     * Readable failure message (null if success).
     */
    private String error;

    /**
     * Stable error code, for example {@code TASKPULSE_ERR_0005}.
     */
    private String errorCode;

    /**
     * Offending fields of a rejected request, keyed by wire name.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, String> fieldErrors;

    /**
     * When the envelope was built.
     */
    @Builder.Default
    private Instant timestamp = Instant.now();

    /**
     * Wraps the payload of a successful call.
     */
    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Acknowledges a successful call that returns nothing, such as a delete.
     */
    public static <T> ApiResponse<T> success() {
        return ApiResponse.<T>builder()
                .success(true)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Reports a failure carrying one of the {@code TASKPULSE_ERR_*} codes.
     */
    public static <T> ApiResponse<T> error(String message, String errorCode) {
        return error(message, errorCode, null);
    }

    /**
     * Reports a rejected request together with the fields that failed validation.
     */
    public static <T> ApiResponse<T> error(String message, String errorCode, Map<String, String> fieldErrors) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(message)
                .errorCode(errorCode)
                .fieldErrors(fieldErrors)
                .timestamp(Instant.now())
                .build();
    }
}
