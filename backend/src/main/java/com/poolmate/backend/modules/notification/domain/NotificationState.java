package com.poolmate.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ,
    EXPIRED
}
