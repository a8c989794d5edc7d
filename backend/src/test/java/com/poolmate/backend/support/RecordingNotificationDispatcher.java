package com.poolmate.backend.support;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import com.poolmate.backend.modules.notification.application.NotificationDispatcher;
import com.poolmate.backend.modules.notification.domain.NotificationKind;

public class RecordingNotificationDispatcher implements NotificationDispatcher {

    public record Sent(UUID userId, NotificationKind kind, Map<String, Object> payload) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void failEveryCall() {
        this.failing = true;
    }

    @Override
    public void notify(UUID userId, NotificationKind kind, Map<String, Object> payload) {
        if (failing) {
            throw new IllegalStateException("dispatcher unavailable");
        }
        sent.add(new Sent(userId, kind, payload));
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    public List<Sent> sent(NotificationKind kind) {
        return sent.stream().filter(item -> item.kind() == kind).toList();
    }
}
