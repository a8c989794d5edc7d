package com.poolmate.backend.modules.draw.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.DrawRound;
import com.poolmate.backend.modules.draw.domain.RoundOutcome;
import com.poolmate.backend.modules.draw.domain.WindowCloseReason;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DrawRoundRepository extends JpaRepository<DrawRound, UUID> {

    Optional<DrawRound> findFirstByPoolIdAndOutcome(UUID poolId, RoundOutcome outcome);

    List<DrawRound> findByOutcome(RoundOutcome outcome);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update DrawRound r
               set r.windowState = com.poolmate.backend.modules.draw.domain.WindowState.AWAITING_RESPONSES
             where r.id = :roundId
               and r.windowState = com.poolmate.backend.modules.draw.domain.WindowState.NOTIFIED
            """)
    int markAwaitingResponses(@Param("roundId") UUID roundId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update DrawRound r
               set r.windowState = com.poolmate.backend.modules.draw.domain.WindowState.CLOSED,
                   r.closeReason = :reason,
                   r.closedAt = :closedAt
             where r.id = :roundId
               and r.windowState <> com.poolmate.backend.modules.draw.domain.WindowState.CLOSED
            """)
    int closeWindow(@Param("roundId") UUID roundId,
                    @Param("reason") WindowCloseReason reason,
                    @Param("closedAt") OffsetDateTime closedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update DrawRound r
               set r.windowState = com.poolmate.backend.modules.draw.domain.WindowState.CLOSED,
                   r.closeReason = com.poolmate.backend.modules.draw.domain.WindowCloseReason.DEADLINE_ELAPSED,
                   r.closedAt = :now
             where r.id = :roundId
               and r.windowState <> com.poolmate.backend.modules.draw.domain.WindowState.CLOSED
               and r.deadlineAt <= :now
            """)
    int closeWindowIfDue(@Param("roundId") UUID roundId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update DrawRound r
               set r.outcome = :outcome,
                   r.outcomeDetail = :detail,
                   r.drawRecordId = :drawRecordId
             where r.id = :roundId
               and r.outcome = com.poolmate.backend.modules.draw.domain.RoundOutcome.IN_PROGRESS
            """)
    int recordOutcome(@Param("roundId") UUID roundId,
                      @Param("outcome") RoundOutcome outcome,
                      @Param("detail") String detail,
                      @Param("drawRecordId") UUID drawRecordId);
}
