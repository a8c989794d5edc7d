package com.poolmate.backend.modules.notification.presentation;

import java.util.List;
import java.util.UUID;

import com.poolmate.backend.modules.notification.application.NotificationService;
import com.poolmate.backend.modules.notification.presentation.dto.NotificationItemResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<List<NotificationItemResponse>> list(@RequestParam("userId") UUID userId) {
        return ResponseEntity.ok(notificationService.listForUser(userId));
    }
}
