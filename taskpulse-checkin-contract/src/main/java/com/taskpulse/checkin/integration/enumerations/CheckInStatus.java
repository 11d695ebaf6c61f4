package com.taskpulse.checkin.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a check-in.
 * A check-in is born PENDING and leaves it exactly once; every other status is terminal.
 */
public enum CheckInStatus {

    /**
     * Waiting for the subject to respond or skip.
     */
    PENDING,

    /**
     * The subject submitted a progress update.
     */
    RESPONDED,

    /**
     * The subject explicitly declined to respond.
     */
    SKIPPED,

    /**
     * The response window closed without any action.
     */
    EXPIRED,

    /**
     * Attention was routed to a manager.
     */
    ESCALATED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CheckInStatus fromJson(String value) {
        return value == null ? null : CheckInStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
