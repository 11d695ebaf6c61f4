package com.taskpulse.checkin.core.engine.timeout.impl;

import com.taskpulse.checkin.core.engine.TaskPulseCheckInEngine;
import com.taskpulse.checkin.core.engine.lifecycle.CreateCheckInCommand;
import com.taskpulse.checkin.core.engine.lifecycle.ITaskPulseCheckInLifecycleService;
import com.taskpulse.checkin.core.engine.support.MutableClock;
import com.taskpulse.checkin.core.engine.timeout.ITaskPulseCheckInExpirySweeper;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static com.taskpulse.checkin.core.engine.support.CheckInTestFixtures.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link TaskPulseCheckInExpirySweeperImpl}.
 */
class TaskPulseCheckInExpirySweeperImplTest {

    private MutableClock clock;
    private ITaskPulseCheckInLifecycleService lifecycle;
    private ITaskPulseCheckInExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MONDAY_1000);
        TaskPulseCheckInEngine engine = TaskPulseCheckInEngine.builder()
                .directory(directory(MONDAY_0800).withAssignment(assignment("task-2", "carol", MONDAY_0800)))
                .clock(clock)
                .build();
        installDefault(engine);
        lifecycle = engine.getLifecycleService();
        sweeper = engine.getExpirySweeper();
    }

    private ICheckIn open(String taskId) {
        return lifecycle.create(CreateCheckInCommand.builder().taskId(taskId).build()).block();
    }

    @Test
    @DisplayName("should expire only check-ins past their response window")
    void shouldExpireOverdueOnly() {
        // Given
        ICheckIn early = open(TASK);
        clock.advance(Duration.ofHours(1));
        ICheckIn later = open("task-2");
        clock.advance(Duration.ofMinutes(90));

        // When / Then
        StepVerifier.create(sweeper.runOnce())
                .expectNext(1)
                .verifyComplete();
        assertEquals(CheckInStatus.EXPIRED, lifecycle.get(early.getId()).block().getStatus());
        assertEquals(CheckInStatus.PENDING, lifecycle.get(later.getId()).block().getStatus());
    }

    @Test
    @DisplayName("should treat the expiry instant itself as still open")
    void shouldKeepCheckInOpenAtExpiryInstant() {
        // Given
        ICheckIn checkIn = open(TASK);
        clock.set(checkIn.getExpiresAt());

        // When / Then
        StepVerifier.create(sweeper.runOnce())
                .expectNext(0)
                .verifyComplete();
    }

    @Test
    @DisplayName("should expire nothing on a repeated sweep")
    void shouldBeIdempotent() {
        // Given
        open(TASK);
        clock.advance(Duration.ofHours(3));
        sweeper.runOnce().block();

        // When / Then
        StepVerifier.create(sweeper.runOnce())
                .expectNext(0)
                .verifyComplete();
    }

    @Test
    @DisplayName("should leave answered check-ins alone")
    void shouldLeaveAnsweredCheckIns() {
        // Given
        ICheckIn checkIn = open(TASK);
        lifecycle.respond(checkIn.getId(), USER, onTrack("done early")).block();
        clock.advance(Duration.ofHours(3));

        // When
        Integer expired = sweeper.runOnce().block();

        // Then
        assertEquals(0, expired);
        assertEquals(CheckInStatus.RESPONDED, lifecycle.get(checkIn.getId()).block().getStatus());
    }
}
