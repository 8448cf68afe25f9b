package com.solusoft.medclaims.features.payments.service;

import static com.solusoft.medclaims.features.audit.service.AuditTrail.details;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.events.ClaimStatusChangedEvent;
import com.solusoft.medclaims.events.PaymentScheduledEvent;
import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.service.AuditTrail;
import com.solusoft.medclaims.features.claims.model.Claim;
import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.claims.repository.ClaimRepository;
import com.solusoft.medclaims.features.claims.service.ClaimAccessService;
import com.solusoft.medclaims.features.claims.workflow.ClaimStatusTransitions;
import com.solusoft.medclaims.features.payments.model.CreatePaymentRequest;
import com.solusoft.medclaims.features.payments.model.Payment;
import com.solusoft.medclaims.features.payments.model.PaymentStatus;
import com.solusoft.medclaims.features.payments.model.PaymentUpdate;
import com.solusoft.medclaims.features.payments.model.PaymentView;
import com.solusoft.medclaims.features.payments.repository.PaymentRepository;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.repository.UserRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.security.Operation;
import com.solusoft.medclaims.support.Paging;

import lombok.extern.slf4j.Slf4j;

/**
 * Schedules and settles claim payments. Scheduling moves the claim to PENDING_PAYMENT,
 * processing moves it to PAID.
 */
@Service
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final ClaimRepository claimRepository;
    private final UserRepository userRepository;
    private final ClaimAccessService claimAccess;
    private final ClaimStatusTransitions transitions;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher events;
    private final AuditTrail auditTrail;

    public PaymentService(PaymentRepository paymentRepository,
                          ClaimRepository claimRepository,
                          UserRepository userRepository,
                          ClaimAccessService claimAccess,
                          ClaimStatusTransitions transitions,
                          AccessPolicy accessPolicy,
                          ApplicationEventPublisher events,
                          AuditTrail auditTrail) {
        this.paymentRepository = paymentRepository;
        this.claimRepository = claimRepository;
        this.userRepository = userRepository;
        this.claimAccess = claimAccess;
        this.transitions = transitions;
        this.accessPolicy = accessPolicy;
        this.events = events;
        this.auditTrail = auditTrail;
    }

    @Transactional
    public PaymentView create(ClaimsPrincipal principal, Long claimId, CreatePaymentRequest request) {
        log.info("Entering create payment");
        log.debug("Input claimId: {}, amount: {}, date: {}", claimId, request.paymentAmount(), request.paymentDate());
        accessPolicy.require(principal, Operation.CREATE_PAYMENT);

        // 1. Claim must be approved; nothing is written otherwise
        Claim claim = claimAccess.loadClaim(claimId);
        ClaimStatus previous = claim.getStatus();
        ClaimStatus next = transitions.afterPaymentScheduled(previous);
        requireWithinApproved(request.paymentAmount(), claim);

        // 2. Payment starts out scheduled
        Instant now = Instant.now();
        Payment payment = new Payment();
        payment.setClaimId(claimId);
        payment.setInvoiceNumber(request.invoiceNumber().trim());
        payment.setPaymentAmount(request.paymentAmount());
        payment.setPaymentDate(request.paymentDate());
        payment.setPaymentStatus(PaymentStatus.SCHEDULED);
        payment.setProcessedById(principal.userId());
        payment.setCreatedAt(now);
        payment.setUpdatedAt(now);
        payment = paymentRepository.save(payment);

        // 3. Claim waits for the money
        claim.setStatus(next);
        claim.setUpdatedAt(now);
        claimRepository.save(claim);

        Long policyholderId = claimAccess.policyholderOf(claim);
        events.publishEvent(new PaymentScheduledEvent(claimId, claim.getReferenceNumber(), policyholderId,
                payment.getPaymentAmount(), payment.getPaymentDate()));
        auditTrail.record(principal, AuditAction.PAYMENT, "Payment", payment.getId(),
                details("claim_id", claimId, "amount", payment.getPaymentAmount()));
        auditTrail.record(principal, AuditAction.STATUS_CHANGE, "Claim", claimId,
                details("old_status", previous, "new_status", next));

        log.info("Payment {} scheduled for claim {}", payment.getId(), claim.getReferenceNumber());
        return view(payment, claim);
    }

    @Transactional(readOnly = true)
    public List<PaymentView> list(ClaimsPrincipal principal, Long claimId, PaymentStatus status, int page, int size) {
        accessPolicy.require(principal, Operation.READ_PAYMENT);
        if (claimId != null) {
            claimAccess.loadAccessibleClaim(principal, claimId);
        }
        return paymentRepository.findVisible(claimId, status == null ? null : status.name(),
                        claimAccess.ownerScope(principal), Paging.limit(size), Paging.offset(page, size))
                .stream()
                .map(payment -> view(payment, claimRepository.findById(payment.getClaimId()).orElse(null)))
                .toList();
    }

    @Transactional(readOnly = true)
    public PaymentView get(ClaimsPrincipal principal, Long paymentId) {
        accessPolicy.require(principal, Operation.READ_PAYMENT);
        Payment payment = loadPayment(paymentId);
        Claim claim = claimAccess.loadAccessibleClaim(principal, payment.getClaimId());
        return view(payment, claim);
    }

    /**
     * Applies changes to a payment. Reaching PROCESSED settles the claim as PAID; doing so a
     * second time is a no-op for the claim.
     */
    @Transactional
    public PaymentView update(ClaimsPrincipal principal, Long paymentId, PaymentUpdate update) {
        log.info("Entering update payment");
        accessPolicy.require(principal, Operation.UPDATE_PAYMENT);
        Payment payment = loadPayment(paymentId);
        Claim claim = claimAccess.loadClaim(payment.getClaimId());

        PaymentStatus newStatus = update.paymentStatus();
        if (payment.getPaymentStatus() == PaymentStatus.PROCESSED && newStatus != null
                && newStatus != PaymentStatus.PROCESSED) {
            throw new InconsistentStateException("Payment " + paymentId + " is already processed");
        }

        if (update.invoiceNumber() != null && !update.invoiceNumber().isBlank()) {
            payment.setInvoiceNumber(update.invoiceNumber().trim());
        }
        if (update.paymentAmount() != null) {
            requireWithinApproved(update.paymentAmount(), claim);
            payment.setPaymentAmount(update.paymentAmount());
        }
        if (update.paymentDate() != null) {
            payment.setPaymentDate(update.paymentDate());
        }
        if (newStatus != null) {
            payment.setPaymentStatus(newStatus);
        }
        payment.setProcessedById(principal.userId());
        payment.setUpdatedAt(Instant.now());
        payment = paymentRepository.save(payment);

        auditTrail.record(principal, AuditAction.PAYMENT, "Payment", paymentId,
                details("claim_id", claim.getId(), "amount", payment.getPaymentAmount(), "status", payment.getPaymentStatus()));

        if (payment.getPaymentStatus() == PaymentStatus.PROCESSED) {
            settle(principal, claim);
        }
        return view(payment, claim);
    }

    private static void requireWithinApproved(BigDecimal amount, Claim claim) {
        if (claim.getApprovedAmount() != null && amount.compareTo(claim.getApprovedAmount()) > 0) {
            throw new InconsistentStateException("Payment amount " + amount
                    + " exceeds the approved amount " + claim.getApprovedAmount());
        }
    }

    private void settle(ClaimsPrincipal principal, Claim claim) {
        ClaimStatus previous = claim.getStatus();
        ClaimStatus next = transitions.afterPaymentProcessed(previous);
        if (previous == next) {
            log.info("Claim {} already {}, nothing to settle", claim.getReferenceNumber(), next);
            return;
        }
        claim.setStatus(next);
        claim.setUpdatedAt(Instant.now());
        claimRepository.save(claim);

        events.publishEvent(new ClaimStatusChangedEvent(claim.getId(), claim.getReferenceNumber(),
                claimAccess.policyholderOf(claim), previous, next));
        auditTrail.record(principal, AuditAction.STATUS_CHANGE, "Claim", claim.getId(),
                details("old_status", previous, "new_status", next));
        log.info("Claim {} settled: {} -> {}", claim.getReferenceNumber(), previous, next);
    }

    private Payment loadPayment(Long paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Payment", paymentId));
    }

    private PaymentView view(Payment payment, Claim claim) {
        String processorName = payment.getProcessedById() == null ? null
                : userRepository.findById(payment.getProcessedById()).map(User::getFullName).orElse(null);
        return PaymentView.of(payment, claim == null ? null : claim.getReferenceNumber(), processorName);
    }
}
