package com.taskpulse.checkin.core.engine.scheduler;

import com.taskpulse.checkin.integration.contract.config.ICheckInConfig;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Work-window arithmetic for check-in slots. All calculations happen in the subject zone
 * so that work hours and weekdays follow the subject's local calendar.
 */
public final class CheckInSlotCalculator {

    private CheckInSlotCalculator() {
    }

    /**
     * Gap between two cycles of a pair, rounded to whole minutes.
     */
    public static Duration interval(ICheckInConfig config) {
        return Duration.ofMinutes(Math.round(config.getIntervalHours() * 60));
    }

    /**
     * Moves a candidate into the work window: before the start hour it moves to the start
     * hour of the same day; at or after the end hour, or on an excluded weekday, it moves to
     * the start hour of the next eligible day. Candidates inside the window are kept.
     */
    public static ZonedDateTime rollIntoWorkWindow(Instant candidate, ZoneId zone, ICheckInConfig config) {
        ZonedDateTime local = candidate.atZone(zone);
        LocalDate day = local.toLocalDate();
        if (!config.isEligibleDay(day.getDayOfWeek())) {
            return firstSlotAfter(day, zone, config);
        }
        LocalTime time = local.toLocalTime();
        LocalTime start = LocalTime.of(config.getWorkStartHour(), 0);
        if (time.isBefore(start)) {
            return ZonedDateTime.of(day, start, zone);
        }
        if (config.getWorkEndHour() < 24 && !time.isBefore(LocalTime.of(config.getWorkEndHour(), 0))) {
            return firstSlotAfter(day, zone, config);
        }
        return local;
    }

    /**
     * Start of the work window on the first eligible day strictly after {@code day}.
     */
    public static ZonedDateTime firstSlotAfter(LocalDate day, ZoneId zone, ICheckInConfig config) {
        LocalDate next = day.plusDays(1);
        for (int i = 0; i < DayOfWeek.values().length && !config.isEligibleDay(next.getDayOfWeek()); i++) {
            next = next.plusDays(1);
        }
        return ZonedDateTime.of(next, LocalTime.of(config.getWorkStartHour(), 0), zone);
    }

    /**
     * Start of the calendar day of {@code slot}, inclusive.
     */
    public static Instant startOfDay(ZonedDateTime slot) {
        return slot.toLocalDate().atStartOfDay(slot.getZone()).toInstant();
    }

    /**
     * Start of the calendar day after {@code slot}, exclusive bound of its day.
     */
    public static Instant endOfDay(ZonedDateTime slot) {
        return slot.toLocalDate().plusDays(1).atStartOfDay(slot.getZone()).toInstant();
    }
}
