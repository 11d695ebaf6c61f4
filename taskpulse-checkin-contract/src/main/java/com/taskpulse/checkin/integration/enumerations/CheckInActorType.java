package com.taskpulse.checkin.integration.enumerations;

/**
 * Kind of actor that caused a check-in transition.
 */
public enum CheckInActorType {
    USER,
    SYSTEM,
    TIMER
}
