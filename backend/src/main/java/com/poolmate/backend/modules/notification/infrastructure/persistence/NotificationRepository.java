package com.poolmate.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.poolmate.backend.modules.notification.domain.Notification;

import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findByUserIdAndDedupeKey(UUID userId, String dedupeKey);

    List<Notification> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
