package com.taskpulse.checkin.integration.enumerations;

/**
 * The scope a check-in config record applies to, from least to most specific.
 */
public enum CheckInConfigScope {
    ORGANIZATION,
    TEAM,
    USER,
    TASK
}
