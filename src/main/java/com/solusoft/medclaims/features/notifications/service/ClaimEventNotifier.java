package com.solusoft.medclaims.features.notifications.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.web.util.HtmlUtils;

import com.solusoft.medclaims.config.AsyncConfig;
import com.solusoft.medclaims.events.ClaimStatusChangedEvent;
import com.solusoft.medclaims.events.ClaimSubmittedEvent;
import com.solusoft.medclaims.events.PaymentScheduledEvent;
import com.solusoft.medclaims.features.notifications.model.NotificationMessage;
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.repository.UserRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns committed claim events into messages for the people involved. Runs on the dispatch
 * pool, so a slow mail server never holds up a request.
 */
@Component
@Slf4j
public class ClaimEventNotifier {

    private final NotificationService notificationService;
    private final UserRepository userRepository;

    public ClaimEventNotifier(NotificationService notificationService, UserRepository userRepository) {
        this.notificationService = notificationService;
        this.userRepository = userRepository;
    }

    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onClaimSubmitted(ClaimSubmittedEvent event) {
        log.info("Entering onClaimSubmitted for claim {}", event.referenceNumber());
        try {
            String ref = event.referenceNumber();
            Optional<User> policyholder = findUser(event.policyholderId());
            String holderName = policyholder.map(User::getFullName).orElse("a policyholder");

            policyholder.ifPresent(holder -> notificationService.deliver(holder, new NotificationMessage(
                    event.claimId(),
                    "Claim Submitted",
                    "Your claim with reference number " + ref + " has been successfully submitted.",
                    "Claim Submission Confirmation - " + ref,
                    page("Claim Submission Confirmation", holder,
                            "Your claim with reference number <strong>" + escape(ref) + "</strong> has been successfully submitted.",
                            "We will review your claim and get back to you as soon as possible.",
                            "Thank you for using our service."))));

            for (User hr : activeUsers(Role.HR)) {
                notificationService.deliver(hr, new NotificationMessage(
                        event.claimId(),
                        "New Claim Submission",
                        "A new claim with reference number " + ref + " has been submitted by " + holderName + ".",
                        "New Claim Submission - " + ref,
                        page("New Claim Submission", hr,
                                "A new claim with reference number <strong>" + escape(ref) + "</strong> has been submitted by "
                                        + escape(holderName) + ".",
                                "Please review the claim at your earliest convenience.")));
            }

            for (User cs : activeUsers(Role.CUSTOMER_SERVICE)) {
                notificationService.deliver(cs, new NotificationMessage(
                        event.claimId(),
                        "New Claim for Review",
                        "A new claim with reference number " + ref + " has been submitted and requires your review.",
                        "New Claim for Review - " + ref,
                        page("New Claim for Review", cs,
                                "A new claim with reference number <strong>" + escape(ref) + "</strong> has been submitted by "
                                        + escape(holderName) + " and requires your review.",
                                "Please review the claim at your earliest convenience.")));
            }
        } catch (RuntimeException e) {
            log.error("Submission notifications for claim {} failed", event.referenceNumber(), e);
        }
    }

    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onStatusChanged(ClaimStatusChangedEvent event) {
        log.info("Entering onStatusChanged for claim {}: {} -> {}", event.referenceNumber(), event.previousStatus(),
                event.newStatus());
        try {
            String ref = event.referenceNumber();
            String description = event.newStatus().description();
            findUser(event.policyholderId()).ifPresent(holder -> notificationService.deliver(holder, new NotificationMessage(
                    event.claimId(),
                    "Claim Status Update",
                    "Your claim with reference number " + ref + " is now " + description + ".",
                    "Claim Status Update - " + ref,
                    page("Claim Status Update", holder,
                            "Your claim with reference number <strong>" + escape(ref) + "</strong> is now <strong>"
                                    + escape(description) + "</strong>.",
                            "You can log in to your account to view more details.",
                            "Thank you for your patience."))));
        } catch (RuntimeException e) {
            log.error("Status notification for claim {} failed", event.referenceNumber(), e);
        }
    }

    @Async(AsyncConfig.DISPATCH_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPaymentScheduled(PaymentScheduledEvent event) {
        log.info("Entering onPaymentScheduled for claim {}", event.referenceNumber());
        try {
            String ref = event.referenceNumber();
            String amount = formatAmount(event.amount());
            String date = String.valueOf(event.paymentDate());
            findUser(event.policyholderId()).ifPresent(holder -> notificationService.deliver(holder, new NotificationMessage(
                    event.claimId(),
                    "Payment Scheduled",
                    "A payment of " + amount + " for your claim with reference number " + ref
                            + " has been scheduled for " + date + ".",
                    "Payment Scheduled - Claim " + ref,
                    page("Payment Scheduled", holder,
                            "We are pleased to inform you that a payment of <strong>" + amount
                                    + "</strong> for your claim with reference number <strong>" + escape(ref)
                                    + "</strong> has been scheduled for <strong>" + date + "</strong>.",
                            "You can log in to your account to view more details.",
                            "Thank you for your patience."))));
        } catch (RuntimeException e) {
            log.error("Payment notification for claim {} failed", event.referenceNumber(), e);
        }
    }

    private Optional<User> findUser(Long userId) {
        return userId == null ? Optional.empty() : userRepository.findById(userId);
    }

    private List<User> activeUsers(Role role) {
        return userRepository.findActiveByRole(role.name());
    }

    static String formatAmount(BigDecimal amount) {
        return amount == null ? "$0.00" : String.format(Locale.ROOT, "$%.2f", amount);
    }

    private static String page(String heading, User recipient, String... paragraphs) {
        StringBuilder html = new StringBuilder()
                .append("<h1>").append(escape(heading)).append("</h1>")
                .append("<p>Dear ").append(escape(recipient.getFullName() == null ? "customer" : recipient.getFullName()))
                .append(",</p>");
        for (String paragraph : paragraphs) {
            html.append("<p>").append(paragraph).append("</p>");
        }
        return html.toString();
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }
}
