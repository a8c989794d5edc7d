package com.poolmate.backend.modules.notification.application;

import java.util.Map;
import java.util.UUID;

import com.poolmate.backend.modules.notification.domain.NotificationKind;

/**
 * Fire-and-forget delivery of draw messages to a member.
 *
 * <p>Implementations must return without waiting for delivery. Callers still guard
 * every call, since a failing dispatcher must never change the outcome of a round.
 */
public interface NotificationDispatcher {

    void notify(UUID userId, NotificationKind kind, Map<String, Object> payload);
}
