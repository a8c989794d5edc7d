package com.poolmate.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.poolmate.backend.modules.notification.domain.Notification;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationItemResponse(
        UUID id,
        String kindCode,
        String title,
        String state,
        OffsetDateTime createdAt,
        OffsetDateTime ttlAt,
        UUID correlationId,
        Map<String, Object> metadata
) {

    public static NotificationItemResponse from(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getKind().name(),
                notification.getTitle(),
                notification.getState().name(),
                notification.getCreatedAt(),
                notification.getTtlAt(),
                notification.getCorrelationId(),
                notification.getMetadata()
        );
    }
}
