package com.taskpulse.checkin.core.engine;

import com.taskpulse.checkin.core.engine.audit.CheckInTransitionRecord;
import com.taskpulse.checkin.core.engine.notification.CheckInNotificationEvent.NotificationEventType;
import com.taskpulse.checkin.core.engine.notification.impl.ConsoleNotificationService;
import com.taskpulse.checkin.core.engine.scheduler.ITaskPulseCheckInScheduler.SweepResult;
import com.taskpulse.checkin.core.engine.support.MutableClock;
import com.taskpulse.checkin.core.exception.CheckInPolicyException;
import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import com.taskpulse.checkin.integration.enumerations.CheckInActorType;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static com.taskpulse.checkin.core.engine.support.CheckInTestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring and end-to-end tests for {@link TaskPulseCheckInEngine}.
 */
class TaskPulseCheckInEngineTest {

    private TaskPulseCheckInEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
    }

    @Test
    @DisplayName("should refuse to start while an organization has no default config")
    void shouldRefuseStartWithoutDefault() {
        // Given
        engine = TaskPulseCheckInEngine.builder()
                .directory(directory(MONDAY_0800))
                .build();

        // When / Then
        StepVerifier.create(engine.start())
                .expectError(CheckInPolicyException.class)
                .verify();
        assertFalse(engine.isRunning());
    }

    @Test
    @DisplayName("should start and stop the background loops")
    void shouldStartAndStop() {
        // Given
        engine = TaskPulseCheckInEngine.builder()
                .directory(directory(MONDAY_0800))
                .clock(new MutableClock(MONDAY_0800))
                .build();
        installDefault(engine);

        // When
        engine.start().block();

        // Then
        assertTrue(engine.isRunning());
        engine.stop();
        assertFalse(engine.isRunning());
    }

    @Test
    @DisplayName("should carry a scheduled check-in through friction to escalation")
    void shouldRunScheduledCheckInToEscalation() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2024-03-04T09:30:00Z"));
        ConsoleNotificationService notifications = new ConsoleNotificationService();
        engine = TaskPulseCheckInEngine.builder()
                .directory(directory(MONDAY_0800))
                .notificationService(notifications)
                .clock(clock)
                .build();
        installDefault(engine);

        // When
        SweepResult sweep = engine.getScheduler().runOnce().block();
        ICheckIn scheduled = engine.getLifecycleService().listPending(USER).blockFirst();
        ICheckIn answered = engine.getLifecycleService()
                .respond(scheduled.getId(), USER, blocked("waiting on design sign-off")).block();

        // Then
        assertEquals(1, sweep.created());
        assertEquals(CheckInStatus.ESCALATED, answered.getStatus());
        assertEquals(MANAGER, answered.getEscalatedTo());
        assertEquals("auto: friction detected (blockers: waiting on design sign-off)", answered.getEscalationReason());
        assertEquals(1, notifications.countSent(NotificationEventType.CHECKIN_DUE));
        assertEquals(1, notifications.countSent(NotificationEventType.CHECKIN_ESCALATED));

        List<CheckInTransitionRecord> trail = engine.getAuditService().getHistory(scheduled.getId()).collectList().block();
        assertEquals(List.of(CheckInStatus.PENDING, CheckInStatus.RESPONDED, CheckInStatus.ESCALATED),
                trail.stream().map(CheckInTransitionRecord::getTo).collect(Collectors.toList()));
        assertEquals(CheckInActorType.SYSTEM, trail.get(0).getActorType());
        assertEquals(CheckInActorType.SYSTEM, trail.get(2).getActorType());
    }
}
