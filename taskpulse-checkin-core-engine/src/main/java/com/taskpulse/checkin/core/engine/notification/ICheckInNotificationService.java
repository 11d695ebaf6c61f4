package com.taskpulse.checkin.core.engine.notification;

import com.taskpulse.checkin.core.engine.notification.CheckInNotificationEvent.NotificationEventType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * Delivery of check-in notifications. Delivery is best effort: the engine logs
 * failures and carries on.
 */
public interface ICheckInNotificationService {

    Mono<NotificationResult> notify(CheckInNotificationEvent event);

    default Flux<NotificationResult> getNotificationHistory(String checkInId) {
        return Flux.empty();
    }

    default Flux<NotificationResult> getNotificationHistoryByRecipient(String recipient) {
        return Flux.empty();
    }

    /**
     * Result of a notification operation.
     */
    record NotificationResult(
            String eventId,
            String checkInId,
            String recipient,
            NotificationEventType eventType,
            NotificationStatus status,
            Instant sentAt,
            String errorMessage,
            Map<String, Object> metadata
    ) {
        public static NotificationResult sent(CheckInNotificationEvent event) {
            return new NotificationResult(event.getEventId(), event.getCheckInId(), event.getRecipient(),
                    event.getEventType(), NotificationStatus.SENT, event.getTimestamp(), null, event.getMetadata());
        }

        public static NotificationResult skipped(CheckInNotificationEvent event, String reason) {
            return new NotificationResult(event.getEventId(), event.getCheckInId(), event.getRecipient(),
                    event.getEventType(), NotificationStatus.SKIPPED, event.getTimestamp(), reason, Map.of());
        }

        public boolean isSuccess() {
            return status == NotificationStatus.SENT;
        }
    }

    enum NotificationStatus {
        SENT,
        FAILED,
        SKIPPED
    }
}
