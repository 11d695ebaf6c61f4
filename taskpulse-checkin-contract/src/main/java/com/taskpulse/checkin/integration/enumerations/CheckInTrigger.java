package com.taskpulse.checkin.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What caused a check-in to be created.
 */
public enum CheckInTrigger {

    /**
     * Created by the recurring scheduler.
     */
    SCHEDULED,

    /**
     * Requested explicitly by a user.
     */
    MANUAL,

    /**
     * Created as a follow-up to an escalation.
     */
    ESCALATION,

    /**
     * Created by another platform component.
     */
    SYSTEM;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CheckInTrigger fromJson(String value) {
        return value == null ? null : CheckInTrigger.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
