package com.solusoft.medclaims.features.notifications.service;

import java.io.UnsupportedEncodingException;
import java.time.Instant;
import java.util.List;

import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.config.MedClaimsProperties;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.notifications.model.Notification;
import com.solusoft.medclaims.features.notifications.model.NotificationChannel;
import com.solusoft.medclaims.features.notifications.model.NotificationMessage;
import com.solusoft.medclaims.features.notifications.repository.NotificationRepository;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.support.Paging;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers messages by email and to the in-app inbox, and serves the inbox to its owner.
 * Delivery failures are logged and never reach the caller.
 */
@Service
@Slf4j
public class NotificationService {

    private final NotificationRepository repository;
    private final JavaMailSender mailSender;
    private final MedClaimsProperties.Notifications settings;

    public NotificationService(NotificationRepository repository, JavaMailSender mailSender,
                               MedClaimsProperties properties) {
        this.repository = repository;
        this.mailSender = mailSender;
        this.settings = properties.getNotifications();
    }

    public void deliver(User recipient, NotificationMessage message) {
        if (recipient == null) {
            log.warn("Dropping notification '{}' for claim {}: no recipient", message.title(), message.claimId());
            return;
        }
        if (settings.isEmailEnabled()) {
            sendEmail(recipient, message);
        }
        if (settings.isInAppEnabled()) {
            storeInApp(recipient, message);
        }
    }

    void sendEmail(User recipient, NotificationMessage message) {
        if (recipient.getEmail() == null || recipient.getEmail().isBlank()) {
            return;
        }
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, "UTF-8");
            helper.setFrom(settings.getFromAddress(), settings.getFromName());
            helper.setTo(recipient.getEmail());
            helper.setSubject(message.subject());
            helper.setText(message.html(), true);
            mailSender.send(mime);
            log.info("Email '{}' sent to user {}", message.subject(), recipient.getId());
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            log.error("Email '{}' to user {} failed: {}", message.subject(), recipient.getId(), e.getMessage());
        }
    }

    void storeInApp(User recipient, NotificationMessage message) {
        try {
            Notification notification = new Notification();
            notification.setUserId(recipient.getId());
            notification.setClaimId(message.claimId());
            notification.setTitle(message.title());
            notification.setMessage(message.message());
            notification.setChannel(NotificationChannel.IN_APP);
            notification.setRead(false);
            notification.setCreatedAt(Instant.now());
            repository.save(notification);
        } catch (RuntimeException e) {
            log.error("In-app notification '{}' for user {} failed", message.title(), recipient.getId(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<Notification> inbox(ClaimsPrincipal principal, boolean unreadOnly, int page, int size) {
        return repository.findInbox(principal.userId(), unreadOnly, Paging.limit(size), Paging.offset(page, size));
    }

    @Transactional
    public Notification markRead(ClaimsPrincipal principal, Long notificationId) {
        Notification notification = repository.findByIdAndUserId(notificationId, principal.userId())
                .orElseThrow(() -> ResourceNotFoundException.of("Notification", notificationId));
        if (!notification.isRead()) {
            notification.setRead(true);
            notification = repository.save(notification);
        }
        return notification;
    }
}
