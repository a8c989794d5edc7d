package com.poolmate.backend.modules.notification.infrastructure.persistence;

import com.poolmate.backend.modules.notification.domain.NotificationDispatchLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationDispatchLogRepository extends JpaRepository<NotificationDispatchLog, Long> {
}
