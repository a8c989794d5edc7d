package com.poolmate.backend.modules.pool.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.poolmate.backend.modules.pool.domain.PoolMember;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PoolMemberRepository extends JpaRepository<PoolMember, UUID> {

    List<PoolMember> findByPoolIdOrderByJoinedAtAscIdAsc(UUID poolId);

    Optional<PoolMember> findByPoolIdAndUserId(UUID poolId, UUID userId);

    Optional<PoolMember> findByIdAndPoolId(UUID id, UUID poolId);
}
