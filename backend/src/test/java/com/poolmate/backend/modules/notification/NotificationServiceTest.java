package com.poolmate.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

import com.poolmate.backend.modules.notification.application.NotificationService;
import com.poolmate.backend.modules.notification.domain.Notification;
import com.poolmate.backend.modules.notification.domain.NotificationDispatchLog;
import com.poolmate.backend.modules.notification.domain.NotificationDispatchStatus;
import com.poolmate.backend.modules.notification.domain.NotificationKind;
import com.poolmate.backend.modules.notification.domain.NotificationState;
import com.poolmate.backend.modules.notification.infrastructure.persistence.NotificationDispatchLogRepository;
import com.poolmate.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private NotificationDispatchLogRepository notificationDispatchLogRepository;

    private Clock clock;
    private SimpleMeterRegistry meterRegistry;
    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2026-03-02T09:00:00Z").toInstant(), ZoneOffset.UTC);
        meterRegistry = new SimpleMeterRegistry();
        notificationService = new NotificationService(
                notificationRepository,
                notificationDispatchLogRepository,
                Runnable::run,
                TransactionOperations.withoutTransaction(),
                meterRegistry,
                clock
        );
    }

    @Test
    @DisplayName("당첨 알림이 저장되고 발송 로그가 남는다")
    void storesNotificationAndDispatchLog() {
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UUID drawId = UUID.randomUUID();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(NotificationService.PAYLOAD_CORRELATION_ID, drawId);
        payload.put("roundNumber", 3);

        notificationService.notify(USER_ID, NotificationKind.DRAW_WINNER, payload);

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        Notification saved = captor.getValue();
        assertThat(saved.getUserId()).isEqualTo(USER_ID);
        assertThat(saved.getTitle()).isEqualTo(NotificationKind.DRAW_WINNER.getTitle());
        assertThat(saved.getState()).isEqualTo(NotificationState.UNREAD);
        assertThat(saved.getDedupeKey()).isEqualTo("DRAW_WINNER:" + drawId);
        assertThat(saved.getCorrelationId()).isEqualTo(drawId);
        assertThat(saved.getTtlAt())
                .isEqualTo(OffsetDateTime.now(clock).plusHours(NotificationKind.DRAW_WINNER.getTtlHours()));
        assertThat(saved.getMetadata())
                .containsEntry(NotificationService.PAYLOAD_CORRELATION_ID, drawId.toString())
                .containsEntry("roundNumber", 3);

        ArgumentCaptor<NotificationDispatchLog> logCaptor = ArgumentCaptor.forClass(NotificationDispatchLog.class);
        verify(notificationDispatchLogRepository).save(logCaptor.capture());
        assertThat(logCaptor.getValue().getStatus()).isEqualTo(NotificationDispatchStatus.SUCCESS);
        assertThat(logCaptor.getValue().getChannel()).isEqualTo("IN_APP");
        assertThat(meterRegistry.counter("poolmate.notifications.dispatched").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("같은 라운드의 같은 종류 알림은 중복 저장되지 않는다")
    void skipsDuplicates() {
        UUID roundId = UUID.randomUUID();
        when(notificationRepository.findByUserIdAndDedupeKey(USER_ID, "DRAW_OPT_IN_REQUEST:" + roundId))
                .thenReturn(Optional.of(new Notification()));

        notificationService.notify(USER_ID, NotificationKind.DRAW_OPT_IN_REQUEST,
                Map.of(NotificationService.PAYLOAD_CORRELATION_ID, roundId));

        verify(notificationRepository, never()).save(any(Notification.class));
        verify(notificationDispatchLogRepository, never()).save(any(NotificationDispatchLog.class));
    }

    @Test
    @DisplayName("저장 실패는 호출자에게 전파되지 않고 실패 건수로 집계된다")
    void deliveryFailureIsCounted() {
        when(notificationRepository.save(any(Notification.class)))
                .thenThrow(new DataAccessResourceFailureException("database unavailable"));

        assertThatCode(() -> notificationService.notify(USER_ID, NotificationKind.DRAW_RESULT, Map.of()))
                .doesNotThrowAnyException();

        assertThat(notificationService.failedDispatchCount()).isEqualTo(1);
        assertThat(meterRegistry.counter("poolmate.notifications.dispatched").count()).isZero();
    }

    @Test
    @DisplayName("발송 큐가 가득 차도 호출자는 실패하지 않는다")
    void rejectedExecutionIsCounted() {
        NotificationService saturated = new NotificationService(
                notificationRepository,
                notificationDispatchLogRepository,
                command -> {
                    throw new RejectedExecutionException("queue full");
                },
                TransactionOperations.withoutTransaction(),
                meterRegistry,
                clock
        );

        assertThatCode(() -> saturated.notify(USER_ID, NotificationKind.DRAW_CANCELLED, null))
                .doesNotThrowAnyException();

        assertThat(saturated.failedDispatchCount()).isEqualTo(1);
        verify(notificationRepository, never()).save(any(Notification.class));
    }
}
