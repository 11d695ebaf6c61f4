package com.taskpulse.checkin.core.engine.notification.impl;

import com.taskpulse.checkin.core.engine.notification.CheckInNotificationEvent;
import com.taskpulse.checkin.core.engine.notification.CheckInNotificationEvent.NotificationEventType;
import com.taskpulse.checkin.core.engine.notification.ICheckInNotificationService;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-based notification service for development and tests.
 * Keeps a history of what was sent so tests can assert on it.
 */
@Slf4j
public class ConsoleNotificationService implements ICheckInNotificationService {

    private final Map<String, List<NotificationResult>> historyByCheckIn = new ConcurrentHashMap<>();
    private final Map<String, List<NotificationResult>> historyByRecipient = new ConcurrentHashMap<>();
    private final List<NotificationResult> allNotifications = new CopyOnWriteArrayList<>();

    private final AtomicLong totalSent = new AtomicLong(0);
    private final Map<NotificationEventType, AtomicLong> byEventType = new ConcurrentHashMap<>();

    private volatile boolean enabled = true;

    public ConsoleNotificationService setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    @Override
    public Mono<NotificationResult> notify(CheckInNotificationEvent event) {
        return Mono.fromCallable(() -> {
            if (!enabled) {
                return NotificationResult.skipped(event, "Console notifications disabled");
            }
            if (!event.hasRecipient()) {
                return NotificationResult.skipped(event, "No recipient specified");
            }

            printNotification(event);

            totalSent.incrementAndGet();
            byEventType.computeIfAbsent(event.getEventType(), k -> new AtomicLong(0)).incrementAndGet();

            NotificationResult result = NotificationResult.sent(event);
            historyByCheckIn.computeIfAbsent(event.getCheckInId(), k -> new CopyOnWriteArrayList<>()).add(result);
            historyByRecipient.computeIfAbsent(event.getRecipient(), k -> new CopyOnWriteArrayList<>()).add(result);
            allNotifications.add(result);
            return result;
        });
    }

    @Override
    public Flux<NotificationResult> getNotificationHistory(String checkInId) {
        return Flux.fromIterable(historyByCheckIn.getOrDefault(checkInId, Collections.emptyList()));
    }

    @Override
    public Flux<NotificationResult> getNotificationHistoryByRecipient(String recipient) {
        return Flux.fromIterable(historyByRecipient.getOrDefault(recipient, Collections.emptyList()));
    }

    public List<NotificationResult> getAllNotifications() {
        return new ArrayList<>(allNotifications);
    }

    public long countSent(NotificationEventType type) {
        AtomicLong count = byEventType.get(type);
        return count == null ? 0 : count.get();
    }

    public void clearHistory() {
        historyByCheckIn.clear();
        historyByRecipient.clear();
        allNotifications.clear();
        totalSent.set(0);
        byEventType.clear();
    }

    private void printNotification(CheckInNotificationEvent event) {
        String line = String.format("[%s] %s -> %s | task=%s | %s",
                event.getEventType().getTitle(),
                event.getCheckInId(),
                event.getRecipient(),
                event.getTaskTitle() != null ? event.getTaskTitle() : event.getTaskId(),
                event.getMessage());
        switch (event.getPriority()) {
            case HIGH -> log.warn(line);
            case LOW -> log.debug(line);
            default -> log.info(line);
        }
    }
}
