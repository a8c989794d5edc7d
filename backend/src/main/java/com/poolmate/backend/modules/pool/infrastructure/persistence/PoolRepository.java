package com.poolmate.backend.modules.pool.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.poolmate.backend.modules.pool.domain.Pool;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PoolRepository extends JpaRepository<Pool, UUID> {

    @Query("""
            select distinct p
              from Pool p
              left join fetch p.members
             where p.id = :poolId
            """)
    Optional<Pool> findWithMembersById(@Param("poolId") UUID poolId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Pool p where p.id = :id")
    Optional<Pool> findByIdForUpdate(@Param("id") UUID id);
}
