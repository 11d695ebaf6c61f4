package com.taskpulse.checkin.core.engine.notification.impl;

import com.taskpulse.checkin.core.engine.notification.CheckInNotificationEvent;
import com.taskpulse.checkin.core.engine.notification.CheckInNotificationEvent.NotificationEventType;
import com.taskpulse.checkin.core.engine.notification.ICheckInNotificationService.NotificationResult;
import com.taskpulse.checkin.core.engine.notification.ICheckInNotificationService.NotificationStatus;
import com.taskpulse.checkin.integration.enumerations.CheckInStatus;
import com.taskpulse.checkin.integration.models.checkin.CheckInModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConsoleNotificationService}.
 */
class ConsoleNotificationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private ConsoleNotificationService service;
    private CheckInModel checkIn;

    @BeforeEach
    void setUp() {
        service = new ConsoleNotificationService();
        checkIn = CheckInModel.builder()
                .id("c-1")
                .orgId("org-1")
                .taskId("task-1")
                .userId("alice")
                .cycleNumber(1)
                .status(CheckInStatus.PENDING)
                .scheduledAt(NOW)
                .expiresAt(NOW.plusSeconds(7200))
                .build();
    }

    @Test
    @DisplayName("should record a sent notification by check-in and recipient")
    void shouldRecordSentNotification() {
        // When
        StepVerifier.create(service.notify(CheckInNotificationEvent.checkInDue(checkIn, "Ship billing export", NOW)))
                .assertNext(result -> {
                    assertTrue(result.isSuccess());
                    assertEquals("alice", result.recipient());
                })
                .verifyComplete();

        // Then
        assertEquals(1, service.countSent(NotificationEventType.CHECKIN_DUE));
        StepVerifier.create(service.getNotificationHistory("c-1"))
                .expectNextCount(1)
                .verifyComplete();
        StepVerifier.create(service.getNotificationHistoryByRecipient("alice"))
                .expectNextMatches(result -> result.eventType() == NotificationEventType.CHECKIN_DUE)
                .verifyComplete();
    }

    @Test
    @DisplayName("should skip events without a recipient")
    void shouldSkipWithoutRecipient() {
        // Given an escalation event with nobody to escalate to
        CheckInNotificationEvent event = CheckInNotificationEvent.checkInEscalated(checkIn, NOW);

        // When
        NotificationResult result = service.notify(event).block();

        // Then
        assertEquals(NotificationStatus.SKIPPED, result.status());
        assertEquals("No recipient specified", result.errorMessage());
        assertTrue(service.getAllNotifications().isEmpty());
    }

    @Test
    @DisplayName("should skip everything while disabled")
    void shouldSkipWhileDisabled() {
        service.setEnabled(false);

        NotificationResult result = service.notify(CheckInNotificationEvent.checkInExpired(checkIn, NOW)).block();

        assertEquals(NotificationStatus.SKIPPED, result.status());
        assertEquals(0, service.countSent(NotificationEventType.CHECKIN_EXPIRED));
    }

    @Test
    @DisplayName("should forget history on clear")
    void shouldClearHistory() {
        service.notify(CheckInNotificationEvent.frictionDetected(checkIn, "bob", NOW)).block();

        service.clearHistory();

        assertTrue(service.getAllNotifications().isEmpty());
        assertEquals(0, service.countSent(NotificationEventType.FRICTION_DETECTED));
        StepVerifier.create(service.getNotificationHistoryByRecipient("bob")).verifyComplete();
    }
}
