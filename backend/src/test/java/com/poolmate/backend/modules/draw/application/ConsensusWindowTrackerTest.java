package com.poolmate.backend.modules.draw.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.draw.domain.DrawRound;
import com.poolmate.backend.modules.draw.domain.EligibilityPolicy;
import com.poolmate.backend.modules.draw.domain.ParticipationDecision;
import com.poolmate.backend.modules.draw.domain.RoundParticipation;
import com.poolmate.backend.modules.draw.domain.WindowCloseReason;
import com.poolmate.backend.modules.draw.domain.WindowState;
import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolMember;
import com.poolmate.backend.support.InMemoryDrawStore;
import com.poolmate.backend.support.MutableClock;
import com.poolmate.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConsensusWindowTrackerTest {

    private MutableClock clock;
    private InMemoryDrawStore store;
    private ConsensusWindowTracker tracker;
    private Pool pool;
    private List<PoolMember> members;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
        store = new InMemoryDrawStore();
        tracker = new ConsensusWindowTracker(store.drawRoundRepository(), store.roundParticipationRepository(),
                store.poolRepository(), store.poolMemberRepository(), clock);
        pool = store.addPool(TestEntities.activePool("office", 30_000L, 4,
                OffsetDateTime.parse("2026-01-01T00:00:00Z")));
        members = pool.getMembers();
    }

    @Test
    @DisplayName("라운드를 열면 모든 후보가 미응답 상태로 알림되고 마감 시각이 정해진다")
    void openStampsCandidates() {
        DrawRound round = open(members);

        assertThat(round.getWindowState()).isEqualTo(WindowState.NOTIFIED);
        assertThat(round.getDeadlineAt()).isEqualTo(OffsetDateTime.now(clock).plusMinutes(15));
        assertThat(store.participations(round.getId()))
                .hasSize(4)
                .allSatisfy(participation -> {
                    assertThat(participation.getDecision()).isEqualTo(ParticipationDecision.UNANSWERED);
                    assertThat(participation.getNotifiedAt()).isEqualTo(OffsetDateTime.now(clock));
                });
    }

    @Test
    @DisplayName("허용 범위를 벗어난 응답 시간은 거부된다")
    void rejectsInvalidWindow() {
        pool.setOptInWindowMinutes(3);

        ProblemException ex = assertThrows(ProblemException.class, () -> open(members));

        assertThat(ex.getCode()).isEqualTo("INVALID_OPT_IN_WINDOW");
        assertThat(store.rounds(pool.getId())).isEmpty();
    }

    @Test
    @DisplayName("진행 중인 라운드가 있으면 새 라운드를 열 수 없다")
    void rejectsSecondRound() {
        open(members);

        ProblemException ex = assertThrows(ProblemException.class, () -> open(members));

        assertThat(ex.getCode()).isEqualTo("ROUND_ALREADY_IN_PROGRESS");
    }

    @Test
    @DisplayName("같은 회원의 응답은 마지막 응답이 유효하다")
    void lastAnswerWins() {
        DrawRound round = open(members);
        PoolMember member = members.get(1);

        tracker.respond(pool.getId(), member.getUserId(), false);
        clock.advance(Duration.ofMinutes(1));
        tracker.respond(pool.getId(), member.getUserId(), true);

        RoundParticipation participation = participation(round, member);
        assertThat(participation.getDecision()).isEqualTo(ParticipationDecision.OPTED_IN);
        assertThat(participation.getRespondedAt()).isEqualTo(OffsetDateTime.now(clock));
    }

    @Test
    @DisplayName("마감 이후의 응답은 WINDOW_CLOSED")
    void answerAfterDeadline() {
        open(members);
        clock.advance(Duration.ofMinutes(15));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> tracker.respond(pool.getId(), members.get(0).getUserId(), true));

        assertThat(ex.getCode()).isEqualTo("WINDOW_CLOSED");
        assertThat(ex.getDetailMessage()).isEqualTo("window closed");
    }

    @Test
    @DisplayName("라운드가 없거나 후보가 아니거나 회원이 아니면 응답이 거부된다")
    void rejectsInvalidResponders() {
        ProblemException noRound = assertThrows(ProblemException.class,
                () -> tracker.respond(pool.getId(), members.get(0).getUserId(), true));
        assertThat(noRound.getCode()).isEqualTo("WINDOW_CLOSED");

        open(members.subList(1, 4));

        ProblemException notCandidate = assertThrows(ProblemException.class,
                () -> tracker.respond(pool.getId(), members.get(0).getUserId(), true));
        assertThat(notCandidate.getCode()).isEqualTo("NOT_A_CANDIDATE");

        ProblemException stranger = assertThrows(ProblemException.class,
                () -> tracker.respond(pool.getId(), UUID.randomUUID(), true));
        assertThat(stranger.getCode()).isEqualTo("MEMBER_NOT_FOUND");
    }

    @Test
    @DisplayName("모든 후보가 응답하면 한 번만 조기 마감된다")
    void closesOnceEveryoneAnswered() {
        DrawRound round = open(members);
        for (PoolMember member : members.subList(0, 3)) {
            tracker.respond(pool.getId(), member.getUserId(), true);
        }
        assertThat(tracker.closeIfComplete(round.getId())).isFalse();

        tracker.respond(pool.getId(), members.get(3).getUserId(), false);

        assertThat(tracker.closeIfComplete(round.getId())).isTrue();
        assertThat(tracker.closeIfComplete(round.getId())).isFalse();
        assertThat(tracker.closeIfDue(round.getId())).isFalse();
        assertThat(store.round(round.getId()).getCloseReason()).isEqualTo(WindowCloseReason.ALL_RESPONDED);
    }

    @Test
    @DisplayName("마감이 지나면 미응답자는 자동 참여하고 명시적 불참은 유지된다")
    void deadlineAutoEnrollsSilentMembers() {
        DrawRound round = open(members);
        tracker.respond(pool.getId(), members.get(0).getUserId(), false);
        tracker.respond(pool.getId(), members.get(2).getUserId(), true);

        assertThat(tracker.closeIfDue(round.getId())).isFalse();
        clock.advance(Duration.ofMinutes(15));
        assertThat(tracker.closeIfDue(round.getId())).isTrue();

        FinalizedCandidates finalized = tracker.finalizeCandidates(round.getId());
        assertThat(finalized.closeReason()).isEqualTo(WindowCloseReason.DEADLINE_ELAPSED);
        assertThat(finalized.optedIn()).containsExactly(members.get(1), members.get(2), members.get(3));
        assertThat(finalized.declinedMemberIds()).containsExactly(members.get(0).getId());
        assertThat(finalized.auditCandidates())
                .extracting(candidate -> candidate.autoEnrolled())
                .containsExactly(true, false, true);
    }

    @Test
    @DisplayName("열린 창의 후보는 확정할 수 없다")
    void finalizeRequiresClosedWindow() {
        DrawRound round = open(members);

        assertThatThrownBy(() -> tracker.finalizeCandidates(round.getId()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("중복 참여 기록은 무결성 오류로 처리된다")
    void duplicateParticipationIsIntegrityViolation() {
        DrawRound round = open(members);
        RoundParticipation duplicate = new RoundParticipation();
        duplicate.setDrawRound(round);
        duplicate.setMember(members.get(2));
        duplicate.setDecision(ParticipationDecision.OPTED_IN);
        store.addParticipationUnchecked(duplicate);
        clock.advance(Duration.ofMinutes(15));
        tracker.closeIfDue(round.getId());

        DrawIntegrityException ex = assertThrows(DrawIntegrityException.class,
                () -> tracker.finalizeCandidates(round.getId()));

        assertThat(ex.getCode()).isEqualTo("DRAW_INTEGRITY_VIOLATION");
        assertThat(ex.getProperties()).containsEntry("memberId", members.get(2).getId().toString());
    }

    @Test
    @DisplayName("중단된 창은 마감 처리되지 않는다")
    void abortedWindowStaysAborted() {
        DrawRound round = open(members);

        assertThat(tracker.abort(round.getId())).isTrue();
        clock.advance(Duration.ofMinutes(15));

        assertThat(tracker.closeIfDue(round.getId())).isFalse();
        assertThat(tracker.isClosed(round.getId())).isTrue();
        assertThat(tracker.finalizeCandidates(round.getId()).closeReason()).isEqualTo(WindowCloseReason.ABORTED);
        assertThat(store.participations(round.getId()))
                .allSatisfy(participation ->
                        assertThat(participation.getDecision()).isEqualTo(ParticipationDecision.UNANSWERED));
    }

    private DrawRound open(List<PoolMember> candidates) {
        return tracker.open(pool, 1, candidates, EligibilityPolicy.STRICT, pool.getTreasurerUserId());
    }

    private RoundParticipation participation(DrawRound round, PoolMember member) {
        return store.participations(round.getId()).stream()
                .filter(participation -> participation.getMember().getId().equals(member.getId()))
                .findFirst()
                .orElseThrow();
    }
}
