package com.poolmate.backend.modules.draw.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.DrawRecord;
import com.poolmate.backend.modules.draw.domain.DrawStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DrawRecordRepository extends JpaRepository<DrawRecord, UUID> {

    @Query("select coalesce(max(d.roundNumber), 0) from DrawRecord d where d.pool.id = :poolId")
    int findMaxRoundNumber(@Param("poolId") UUID poolId);

    boolean existsByPoolIdAndWinnerIdAndStatus(UUID poolId, UUID winnerId, DrawStatus status);

    @Query("select d.winner.id from DrawRecord d where d.pool.id = :poolId and d.status = :status")
    List<UUID> findWinnerMemberIds(@Param("poolId") UUID poolId, @Param("status") DrawStatus status);

    @Query("""
            select d
              from DrawRecord d
              join fetch d.pool
              join fetch d.winner
             where d.id = :drawId
            """)
    Optional<DrawRecord> findDetailedById(@Param("drawId") UUID drawId);

    @Query("""
            select d
              from DrawRecord d
              join fetch d.pool p
              join fetch d.winner
             where p.id = :poolId
               and d.roundNumber = :roundNumber
            """)
    Optional<DrawRecord> findDetailedByPoolIdAndRoundNumber(@Param("poolId") UUID poolId,
                                                            @Param("roundNumber") int roundNumber);

    @Query("""
            select d
              from DrawRecord d
              join fetch d.pool p
              join fetch d.winner
             where p.id = :poolId
             order by d.roundNumber asc
            """)
    List<DrawRecord> findDetailedByPoolId(@Param("poolId") UUID poolId);

    @Query("""
            select d
              from DrawRecord d
              join fetch d.pool p
              join fetch d.winner
             where p.id = :poolId
               and d.status = :status
             order by d.roundNumber asc
            """)
    List<DrawRecord> findDetailedByPoolIdAndStatus(@Param("poolId") UUID poolId, @Param("status") DrawStatus status);

    @Query("""
            select d
              from DrawRecord d
              join fetch d.pool
              join fetch d.winner w
             where w.userId = :userId
               and d.status = com.poolmate.backend.modules.draw.domain.DrawStatus.COMPLETED
             order by d.drawnAt asc
            """)
    List<DrawRecord> findWinningsByUserId(@Param("userId") UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update DrawRecord d
               set d.status = com.poolmate.backend.modules.draw.domain.DrawStatus.CANCELLED,
                   d.cancelReason = :reason,
                   d.cancelledBy = :actorId,
                   d.cancelledAt = :cancelledAt
             where d.id = :drawId
               and d.status = com.poolmate.backend.modules.draw.domain.DrawStatus.COMPLETED
            """)
    int markCancelled(@Param("drawId") UUID drawId,
                      @Param("reason") String reason,
                      @Param("actorId") UUID actorId,
                      @Param("cancelledAt") OffsetDateTime cancelledAt);
}
