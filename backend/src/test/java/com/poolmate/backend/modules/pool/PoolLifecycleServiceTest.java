package com.poolmate.backend.modules.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.audit.application.AuditLogService;
import com.poolmate.backend.modules.pool.application.PoolLifecycleService;
import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolMember;
import com.poolmate.backend.modules.pool.domain.PoolStatus;
import com.poolmate.backend.modules.pool.infrastructure.persistence.PoolRepository;
import com.poolmate.backend.modules.pool.presentation.dto.PoolResponse;
import com.poolmate.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PoolLifecycleServiceTest {

    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private PoolRepository poolRepository;

    @Mock
    private AuditLogService auditLogService;

    private Clock clock;
    private PoolLifecycleService service;
    private Pool pool;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2026-03-02T09:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new PoolLifecycleService(poolRepository, auditLogService, clock);
        pool = TestEntities.activePool("neighbours", 20_000L, 3, OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        pool.setStatus(PoolStatus.PENDING);
        pool.setActivatedAt(null);
        when(poolRepository.findWithMembersById(pool.getId())).thenReturn(Optional.of(pool));
        lenient().when(poolRepository.save(any(Pool.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("회계 담당자와 최소 인원이 갖춰지면 활성화되고 감사 로그가 남는다")
    void activatesPendingPool() {
        PoolResponse response = service.activate(pool.getId(), ADMIN_ID);

        assertThat(response.status()).isEqualTo("ACTIVE");
        assertThat(response.activatedAt()).isEqualTo(OffsetDateTime.now(clock));
        verify(auditLogService).record(argThat(command ->
                "POOL_ACTIVATE".equals(command.actionType()) && ADMIN_ID.equals(command.actorUserId())));
    }

    @Test
    @DisplayName("회계 담당자가 없으면 활성화할 수 없다")
    void activationNeedsTreasurer() {
        pool.setTreasurerUserId(null);

        ProblemException ex = assertThrows(ProblemException.class, () -> service.activate(pool.getId(), ADMIN_ID));

        assertThat(ex.getCode()).isEqualTo("TREASURER_REQUIRED");
        verify(poolRepository, never()).save(any(Pool.class));
    }

    @Test
    @DisplayName("최소 인원보다 관리 좌석 두 명이 더 필요하다")
    void activationNeedsManagementSeats() {
        pool.setMinMembers(2);

        ProblemException ex = assertThrows(ProblemException.class, () -> service.activate(pool.getId(), ADMIN_ID));

        assertThat(ex.getCode()).isEqualTo("ROSTER_TOO_SMALL");
        assertThat(ex.getProperties()).containsEntry("required", 4).containsEntry("current", 3);
    }

    @Test
    @DisplayName("일시 중지와 재개는 상태 순서를 지켜야 한다")
    void suspendAndResume() {
        pool.setStatus(PoolStatus.ACTIVE);

        assertThat(service.suspend(pool.getId(), ADMIN_ID).status()).isEqualTo("SUSPENDED");
        ProblemException twice = assertThrows(ProblemException.class, () -> service.suspend(pool.getId(), ADMIN_ID));
        assertThat(twice.getCode()).isEqualTo("POOL_NOT_ACTIVE");

        assertThat(service.resume(pool.getId(), ADMIN_ID).status()).isEqualTo("ACTIVE");
        ProblemException notSuspended = assertThrows(ProblemException.class,
                () -> service.resume(pool.getId(), ADMIN_ID));
        assertThat(notSuspended.getCode()).isEqualTo("POOL_NOT_SUSPENDED");
    }

    @Test
    @DisplayName("수령하지 않은 회원이 남아 있으면 종료할 수 없다")
    void closeNeedsEveryoneServed() {
        pool.setStatus(PoolStatus.ACTIVE);
        OffsetDateTime wonAt = OffsetDateTime.parse("2026-02-01T00:00:00Z");
        pool.getMembers().get(0).markWon(wonAt, 60_000L);

        ProblemException ex = assertThrows(ProblemException.class, () -> service.close(pool.getId(), ADMIN_ID));
        assertThat(ex.getCode()).isEqualTo("MEMBERS_STILL_WAITING");
        assertThat(ex.getProperties()).containsEntry("waiting", 2L);

        for (PoolMember member : pool.getMembers()) {
            member.markWon(wonAt, 60_000L);
        }
        PoolResponse closed = service.close(pool.getId(), ADMIN_ID);
        assertThat(closed.status()).isEqualTo("CLOSED");
        assertThat(closed.closedAt()).isEqualTo(OffsetDateTime.now(clock));
    }
}
