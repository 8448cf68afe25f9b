package com.solusoft.medclaims.features.payments.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;

import com.solusoft.medclaims.events.ClaimStatusChangedEvent;
import com.solusoft.medclaims.events.PaymentScheduledEvent;
import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.PermissionDeniedException;
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
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.features.users.repository.UserRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;

public class PaymentServiceTest {

    private static final ClaimsPrincipal FINANCE = new ClaimsPrincipal(20L, "finance@example.com", Role.FINANCE);

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private ClaimRepository claimRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ClaimAccessService claimAccess;

    @Mock
    private ApplicationEventPublisher events;

    @Mock
    private AuditTrail auditTrail;

    private PaymentService service;

    private Claim claim;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        service = new PaymentService(paymentRepository, claimRepository, userRepository, claimAccess,
                new ClaimStatusTransitions(), new AccessPolicy(), events, auditTrail);

        claim = new Claim();
        claim.setId(1L);
        claim.setPolicyId(5L);
        claim.setReferenceNumber("CLM-00C0FFEE");
        claim.setRequestedAmount(new BigDecimal("600.00"));
        claim.setApprovedAmount(new BigDecimal("500.00"));
        claim.setStatus(ClaimStatus.APPROVED);

        when(claimAccess.loadClaim(1L)).thenReturn(claim);
        when(claimAccess.policyholderOf(claim)).thenReturn(42L);
        when(claimRepository.save(any(Claim.class))).thenAnswer(inv -> inv.getArgument(0));
        when(paymentRepository.save(any(Payment.class))).thenAnswer(inv -> {
            Payment payment = inv.getArgument(0);
            if (payment.getId() == null) {
                payment.setId(300L);
            }
            return payment;
        });
        when(userRepository.findById(any())).thenReturn(Optional.empty());
    }

    private CreatePaymentRequest request(String amount) {
        return new CreatePaymentRequest("INV-001", new BigDecimal(amount), LocalDate.of(2026, 11, 1), null);
    }

    private Payment scheduledPayment() {
        Payment payment = new Payment();
        payment.setId(300L);
        payment.setClaimId(1L);
        payment.setInvoiceNumber("INV-001");
        payment.setPaymentAmount(new BigDecimal("500.00"));
        payment.setPaymentDate(LocalDate.of(2026, 11, 1));
        payment.setPaymentStatus(PaymentStatus.SCHEDULED);
        when(paymentRepository.findById(300L)).thenReturn(Optional.of(payment));
        return payment;
    }

    @Test
    public void testCreate_approvedClaim_schedulesPaymentAndMovesToPendingPayment() {
        PaymentView view = service.create(FINANCE, 1L, request("500.00"));

        assertEquals(PaymentStatus.SCHEDULED, view.paymentStatus());
        assertEquals("CLM-00C0FFEE", view.claimReference());
        assertEquals(20L, view.processedById());
        assertEquals(ClaimStatus.PENDING_PAYMENT, claim.getStatus());

        ArgumentCaptor<PaymentScheduledEvent> event = ArgumentCaptor.forClass(PaymentScheduledEvent.class);
        verify(events).publishEvent(event.capture());
        assertEquals(42L, event.getValue().policyholderId());
        assertEquals(new BigDecimal("500.00"), event.getValue().amount());
    }

    @Test
    public void testCreate_partiallyApprovedClaim_isPayable() {
        claim.setStatus(ClaimStatus.PARTIALLY_APPROVED);

        service.create(FINANCE, 1L, request("250.00"));

        assertEquals(ClaimStatus.PENDING_PAYMENT, claim.getStatus());
    }

    @Test
    public void testCreate_claimNotApproved_throwsWithoutWriting() {
        for (ClaimStatus status : ClaimStatus.values()) {
            if (status.isPayable()) {
                continue;
            }
            claim.setStatus(status);

            assertThrows(InconsistentStateException.class, () -> service.create(FINANCE, 1L, request("100.00")));
            assertEquals(status, claim.getStatus());
        }
        verify(paymentRepository, never()).save(any(Payment.class));
        verify(claimRepository, never()).save(any(Claim.class));
        verifyNoInteractions(events);
    }

    @Test
    public void testCreate_amountAboveApproved_throws() {
        assertThrows(InconsistentStateException.class, () -> service.create(FINANCE, 1L, request("500.01")));
        verify(paymentRepository, never()).save(any(Payment.class));
    }

    @Test
    public void testCreate_policyholder_isDenied() {
        ClaimsPrincipal holder = new ClaimsPrincipal(42L, "holder@example.com", Role.POLICYHOLDER);

        assertThrows(PermissionDeniedException.class, () -> service.create(holder, 1L, request("100.00")));
    }

    @Test
    public void testUpdate_processed_settlesClaimAsPaid() {
        claim.setStatus(ClaimStatus.PENDING_PAYMENT);
        scheduledPayment();

        PaymentView view = service.update(FINANCE, 300L, new PaymentUpdate(null, null, null, PaymentStatus.PROCESSED));

        assertEquals(PaymentStatus.PROCESSED, view.paymentStatus());
        assertEquals(ClaimStatus.PAID, claim.getStatus());
        ArgumentCaptor<ClaimStatusChangedEvent> event = ArgumentCaptor.forClass(ClaimStatusChangedEvent.class);
        verify(events).publishEvent(event.capture());
        assertEquals(ClaimStatus.PAID, event.getValue().newStatus());
    }

    @Test
    public void testUpdate_processedAgain_isIdempotent() {
        claim.setStatus(ClaimStatus.PENDING_PAYMENT);
        Payment payment = scheduledPayment();

        service.update(FINANCE, 300L, new PaymentUpdate(null, null, null, PaymentStatus.PROCESSED));
        assertEquals(PaymentStatus.PROCESSED, payment.getPaymentStatus());
        service.update(FINANCE, 300L, new PaymentUpdate(null, null, null, PaymentStatus.PROCESSED));

        assertEquals(ClaimStatus.PAID, claim.getStatus());
        verify(claimRepository, times(1)).save(claim);
        verify(events, times(1)).publishEvent(any(ClaimStatusChangedEvent.class));
    }

    @Test
    public void testUpdate_failedPayment_leavesClaimPending() {
        claim.setStatus(ClaimStatus.PENDING_PAYMENT);
        scheduledPayment();

        service.update(FINANCE, 300L, new PaymentUpdate(null, null, null, PaymentStatus.FAILED));

        assertEquals(ClaimStatus.PENDING_PAYMENT, claim.getStatus());
        verify(claimRepository, never()).save(any(Claim.class));
    }

    @Test
    public void testUpdate_processedPaymentCannotGoBack() {
        claim.setStatus(ClaimStatus.PAID);
        Payment payment = scheduledPayment();
        payment.setPaymentStatus(PaymentStatus.PROCESSED);

        assertThrows(InconsistentStateException.class,
                () -> service.update(FINANCE, 300L, new PaymentUpdate(null, null, null, PaymentStatus.SCHEDULED)));
        assertEquals(ClaimStatus.PAID, claim.getStatus());
    }

    @Test
    public void testUpdate_amountAboveApproved_throws() {
        claim.setStatus(ClaimStatus.PENDING_PAYMENT);
        Payment payment = scheduledPayment();

        assertThrows(InconsistentStateException.class,
                () -> service.update(FINANCE, 300L, new PaymentUpdate(null, new BigDecimal("550.00"), null, null)));
        assertEquals(new BigDecimal("500.00"), payment.getPaymentAmount());
        verify(paymentRepository, never()).save(any(Payment.class));
    }

    @Test
    public void testUpdate_amountWithinApproved_isApplied() {
        claim.setStatus(ClaimStatus.PENDING_PAYMENT);
        scheduledPayment();

        PaymentView view = service.update(FINANCE, 300L, new PaymentUpdate(null, new BigDecimal("450.00"), null, null));

        assertEquals(new BigDecimal("450.00"), view.paymentAmount());
        assertEquals(ClaimStatus.PENDING_PAYMENT, claim.getStatus());
    }
}
