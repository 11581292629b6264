package com.apflow.invoice.orchestrator.api;

import com.apflow.invoice.notification.ReviewNotification;
import com.apflow.invoice.orchestrator.notification.NotificationDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationDispatcher notificationDispatcher;

    public NotificationController(NotificationDispatcher notificationDispatcher) {
        this.notificationDispatcher = notificationDispatcher;
    }

    @GetMapping
    public ResponseEntity<List<ReviewNotification>> getNotifications(@RequestParam(required = false) String runId) {
        if (runId != null && !runId.isEmpty()) {
            return ResponseEntity.ok(notificationDispatcher.getHistory(runId));
        }
        return ResponseEntity.ok(notificationDispatcher.getHistory());
    }
}
