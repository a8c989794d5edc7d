package com.poolmate.backend.modules.draw.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.ParticipationDecision;
import com.poolmate.backend.modules.draw.domain.RoundParticipation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoundParticipationRepository extends JpaRepository<RoundParticipation, UUID> {

    @Query("""
            select p
              from RoundParticipation p
              join fetch p.member m
             where p.drawRound.id = :roundId
             order by m.joinedAt asc, m.id asc
            """)
    List<RoundParticipation> findByRoundIdOrdered(@Param("roundId") UUID roundId);

    Optional<RoundParticipation> findByDrawRoundIdAndMemberId(UUID drawRoundId, UUID memberId);

    long countByDrawRoundIdAndDecision(UUID drawRoundId, ParticipationDecision decision);

    /**
     * Applies one member's answer. Matches nothing once the window is closed or its deadline has passed.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RoundParticipation p
               set p.decision = :decision,
                   p.respondedAt = :now,
                   p.autoEnrolled = false
             where p.drawRound.id = :roundId
               and p.member.id = :memberId
               and exists (
                    select r.id
                      from DrawRound r
                     where r.id = :roundId
                       and r.windowState in (
                            com.poolmate.backend.modules.draw.domain.WindowState.NOTIFIED,
                            com.poolmate.backend.modules.draw.domain.WindowState.AWAITING_RESPONSES)
                       and r.deadlineAt > :now)
            """)
    int recordDecision(@Param("roundId") UUID roundId,
                       @Param("memberId") UUID memberId,
                       @Param("decision") ParticipationDecision decision,
                       @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RoundParticipation p
               set p.decision = com.poolmate.backend.modules.draw.domain.ParticipationDecision.OPTED_IN,
                   p.autoEnrolled = true
             where p.drawRound.id = :roundId
               and p.decision = com.poolmate.backend.modules.draw.domain.ParticipationDecision.UNANSWERED
            """)
    int autoEnrollUnanswered(@Param("roundId") UUID roundId);
}
