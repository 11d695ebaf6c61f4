package com.taskpulse.checkin.core.engine.notification;

import com.taskpulse.checkin.integration.contract.checkin.ICheckIn;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.With;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Notification about a check-in, addressed to a single recipient.
 *
 * <pre>{@code
 * notificationService.notify(CheckInNotificationEvent.checkInDue(checkIn, "Ship billing export", now))
 *     .subscribe();
 * }</pre>
 */
@Data
@Builder(toBuilder = true)
@With
public class CheckInNotificationEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private final String eventId = UUID.randomUUID().toString();

    private final Instant timestamp;

    private final NotificationEventType eventType;

    @Builder.Default
    private final NotificationPriority priority = NotificationPriority.NORMAL;

    private final String checkInId;
    private final String orgId;
    private final String taskId;
    private final String taskTitle;
    private final String recipient;
    private final String message;
    private final String reason;

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static CheckInNotificationEvent checkInDue(ICheckIn checkIn, String taskTitle, Instant now) {
        return base(checkIn, NotificationEventType.CHECKIN_DUE, now)
                .taskTitle(taskTitle)
                .recipient(checkIn.getUserId())
                .message("How's progress on: " + (taskTitle != null ? taskTitle : checkIn.getTaskId()) + "?")
                .metadata(Map.of("cycleNumber", checkIn.getCycleNumber(), "expiresAt", String.valueOf(checkIn.getExpiresAt())))
                .build();
    }

    public static CheckInNotificationEvent checkInExpired(ICheckIn checkIn, Instant now) {
        return base(checkIn, NotificationEventType.CHECKIN_EXPIRED, now)
                .recipient(checkIn.getUserId())
                .priority(NotificationPriority.LOW)
                .message("A check-in expired without a response")
                .build();
    }

    public static CheckInNotificationEvent checkInEscalated(ICheckIn checkIn, Instant now) {
        return base(checkIn, NotificationEventType.CHECKIN_ESCALATED, now)
                .recipient(checkIn.getEscalatedTo())
                .priority(NotificationPriority.HIGH)
                .reason(checkIn.getEscalationReason())
                .message("Check-in Escalated to You: " + checkIn.getEscalationReason())
                .build();
    }

    public static CheckInNotificationEvent frictionDetected(ICheckIn checkIn, String recipient, Instant now) {
        return base(checkIn, NotificationEventType.FRICTION_DETECTED, now)
                .recipient(recipient)
                .priority(NotificationPriority.HIGH)
                .reason(checkIn.getBlockersReported())
                .message("Friction detected on a check-in of " + checkIn.getUserId())
                .build();
    }

    private static CheckInNotificationEventBuilder base(ICheckIn checkIn, NotificationEventType type, Instant now) {
        return CheckInNotificationEvent.builder()
                .eventType(type)
                .timestamp(now)
                .checkInId(checkIn.getId())
                .orgId(checkIn.getOrgId())
                .taskId(checkIn.getTaskId());
    }

    public boolean hasRecipient() {
        return recipient != null && !recipient.isBlank();
    }

    // ========================================================================
    // ENUMS
    // ========================================================================

    @Getter
    @RequiredArgsConstructor
    public enum NotificationEventType {
        CHECKIN_DUE("Check-in Due"),
        CHECKIN_EXPIRED("Check-in Expired"),
        CHECKIN_ESCALATED("Check-in Escalated"),
        FRICTION_DETECTED("Friction Detected");

        private final String title;
    }

    public enum NotificationPriority {
        LOW,
        NORMAL,
        HIGH
    }
}
