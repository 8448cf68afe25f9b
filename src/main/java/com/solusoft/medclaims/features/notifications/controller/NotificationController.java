package com.solusoft.medclaims.features.notifications.controller;

import java.util.List;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.features.notifications.model.Notification;
import com.solusoft.medclaims.features.notifications.service.NotificationService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public List<Notification> inbox(@AuthenticationPrincipal ClaimsPrincipal principal,
                                    @RequestParam(defaultValue = "false") boolean unreadOnly,
                                    @RequestParam(defaultValue = "0") int page,
                                    @RequestParam(defaultValue = "20") int size) {
        return notificationService.inbox(principal, unreadOnly, page, size);
    }

    @PostMapping("/{notificationId}/read")
    public Notification markRead(@AuthenticationPrincipal ClaimsPrincipal principal,
                                 @PathVariable Long notificationId) {
        return notificationService.markRead(principal, notificationId);
    }
}
