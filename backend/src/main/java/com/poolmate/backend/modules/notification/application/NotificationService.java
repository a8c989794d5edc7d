package com.poolmate.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;

import com.poolmate.backend.modules.notification.domain.Notification;
import com.poolmate.backend.modules.notification.domain.NotificationDispatchLog;
import com.poolmate.backend.modules.notification.domain.NotificationDispatchStatus;
import com.poolmate.backend.modules.notification.domain.NotificationKind;
import com.poolmate.backend.modules.notification.domain.NotificationState;
import com.poolmate.backend.modules.notification.infrastructure.persistence.NotificationDispatchLogRepository;
import com.poolmate.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.poolmate.backend.modules.notification.presentation.dto.NotificationItemResponse;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * In-app implementation of {@link NotificationDispatcher}. Delivery runs on a dedicated
 * executor; failures are logged with an {@code [ALERT]} marker and counted, never rethrown.
 */
@Service
public class NotificationService implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    public static final String PAYLOAD_CORRELATION_ID = "correlationId";
    private static final String CHANNEL = "IN_APP";
    private static final String ERROR_REJECTED = "DISPATCH_REJECTED";
    private static final String ERROR_DELIVERY = "DELIVERY_FAILED";

    private final NotificationRepository notificationRepository;
    private final NotificationDispatchLogRepository notificationDispatchLogRepository;
    private final Executor notificationExecutor;
    private final TransactionOperations transactionOperations;
    private final Clock clock;
    private final Counter dispatchedCounter;
    private final Counter failedCounter;

    public NotificationService(
            NotificationRepository notificationRepository,
            NotificationDispatchLogRepository notificationDispatchLogRepository,
            @Qualifier("notificationExecutor") Executor notificationExecutor,
            TransactionOperations transactionOperations,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.notificationDispatchLogRepository = notificationDispatchLogRepository;
        this.notificationExecutor = notificationExecutor;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
        this.dispatchedCounter = Counter.builder("poolmate.notifications.dispatched").register(meterRegistry);
        this.failedCounter = Counter.builder("poolmate.notifications.failed").register(meterRegistry);
    }

    @Override
    public void notify(UUID userId, NotificationKind kind, Map<String, Object> payload) {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(kind, "kind is required");
        Map<String, Object> metadata = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        try {
            notificationExecutor.execute(() -> deliver(userId, kind, metadata));
        } catch (RuntimeException ex) {
            recordFailure(userId, kind, ERROR_REJECTED, ex);
        }
    }

    public List<NotificationItemResponse> listForUser(UUID userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(NotificationItemResponse::from)
                .toList();
    }

    public long failedDispatchCount() {
        return (long) failedCounter.count();
    }

    private void deliver(UUID userId, NotificationKind kind, Map<String, Object> metadata) {
        try {
            transactionOperations.executeWithoutResult(status -> store(userId, kind, metadata));
            dispatchedCounter.increment();
        } catch (RuntimeException ex) {
            recordFailure(userId, kind, ERROR_DELIVERY, ex);
        }
    }

    private void store(UUID userId, NotificationKind kind, Map<String, Object> metadata) {
        UUID correlationId = metadata.get(PAYLOAD_CORRELATION_ID) instanceof UUID uuid ? uuid : null;
        String dedupeKey = correlationId != null ? kind.name() + ":" + correlationId : null;
        if (dedupeKey != null && notificationRepository.findByUserIdAndDedupeKey(userId, dedupeKey).isPresent()) {
            return;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Notification notification = new Notification();
        notification.setUserId(userId);
        notification.setKind(kind);
        notification.setTitle(kind.getTitle());
        notification.setState(NotificationState.UNREAD);
        notification.setDedupeKey(dedupeKey);
        notification.setTtlAt(now.plusHours(kind.getTtlHours()));
        notification.setCorrelationId(correlationId);
        notification.setMetadata(stringifyIdentifiers(metadata));
        Notification saved = notificationRepository.save(notification);

        NotificationDispatchLog logEntry = new NotificationDispatchLog();
        logEntry.setNotification(saved);
        logEntry.setChannel(CHANNEL);
        logEntry.setStatus(NotificationDispatchStatus.SUCCESS);
        logEntry.setLoggedAt(now);
        notificationDispatchLogRepository.save(logEntry);
    }

    private Map<String, Object> stringifyIdentifiers(Map<String, Object> metadata) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        metadata.forEach((key, value) -> normalized.put(key, value instanceof UUID ? value.toString() : value));
        return normalized;
    }

    private void recordFailure(UUID userId, NotificationKind kind, String errorCode, RuntimeException ex) {
        failedCounter.increment();
        log.warn("[ALERT][Notification][{}] user={} errorCode={} detail={}",
                kind,
                userId,
                errorCode,
                ex.getMessage(),
                ex);
    }
}
