package com.poolmate.backend.modules.notification.domain;

public enum NotificationDispatchStatus {
    SUCCESS,
    FAILED
}
