package com.taskpulse.checkin.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Self-reported progress of the subject on the task.
 * Serialized in snake case: {@code on_track}, {@code at_risk}, {@code blocked}, {@code completed}.
 */
public enum ProgressIndicator {

    ON_TRACK,
    AT_RISK,
    BLOCKED,
    COMPLETED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProgressIndicator fromJson(String value) {
        return value == null ? null : ProgressIndicator.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
