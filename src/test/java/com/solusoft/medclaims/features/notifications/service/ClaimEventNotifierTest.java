package com.solusoft.medclaims.features.notifications.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.medclaims.events.ClaimStatusChangedEvent;
import com.solusoft.medclaims.events.ClaimSubmittedEvent;
import com.solusoft.medclaims.events.PaymentScheduledEvent;
import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.notifications.model.NotificationMessage;
import com.solusoft.medclaims.features.users.model.Role;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.repository.UserRepository;

public class ClaimEventNotifierTest {

    @Mock
    private NotificationService notificationService;

    @Mock
    private UserRepository userRepository;

    private ClaimEventNotifier notifier;

    private User holder;
    private User hr;
    private User csAgent;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        notifier = new ClaimEventNotifier(notificationService, userRepository);

        holder = user(42L, "Pat <Holder>", Role.POLICYHOLDER);
        hr = user(30L, "Hana HR", Role.HR);
        csAgent = user(10L, "Casey CS", Role.CUSTOMER_SERVICE);
        when(userRepository.findById(42L)).thenReturn(Optional.of(holder));
        when(userRepository.findActiveByRole("HR")).thenReturn(List.of(hr));
        when(userRepository.findActiveByRole("CUSTOMER_SERVICE")).thenReturn(List.of(csAgent));
    }

    private static User user(Long id, String name, Role role) {
        User user = new User();
        user.setId(id);
        user.setFullName(name);
        user.setEmail(role.name().toLowerCase() + "@example.com");
        user.setRole(role);
        return user;
    }

    @Test
    public void testOnClaimSubmitted_notifiesHolderHrAndCustomerService() {
        notifier.onClaimSubmitted(new ClaimSubmittedEvent(1L, "CLM-0A0B0C0D", 42L));

        ArgumentCaptor<NotificationMessage> toHolder = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).deliver(eq(holder), toHolder.capture());
        assertEquals("Claim Submitted", toHolder.getValue().title());
        assertEquals("Claim Submission Confirmation - CLM-0A0B0C0D", toHolder.getValue().subject());
        assertTrue(toHolder.getValue().html().contains("Pat &lt;Holder&gt;"));

        ArgumentCaptor<NotificationMessage> toHr = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).deliver(eq(hr), toHr.capture());
        assertEquals("New Claim Submission", toHr.getValue().title());
        assertTrue(toHr.getValue().message().endsWith("submitted by Pat <Holder>."));

        ArgumentCaptor<NotificationMessage> toCs = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).deliver(eq(csAgent), toCs.capture());
        assertEquals("New Claim for Review", toCs.getValue().title());
    }

    @Test
    public void testOnStatusChanged_usesReadableStatus() {
        notifier.onStatusChanged(new ClaimStatusChangedEvent(1L, "CLM-0A0B0C0D", 42L,
                ClaimStatus.SUBMITTED, ClaimStatus.UNDER_REVIEW_CLAIMS));

        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).deliver(eq(holder), captor.capture());
        assertEquals("Your claim with reference number CLM-0A0B0C0D is now under review by Claims Department.",
                captor.getValue().message());
        assertEquals("Claim Status Update - CLM-0A0B0C0D", captor.getValue().subject());
    }

    @Test
    public void testOnPaymentScheduled_formatsAmountAndDate() {
        notifier.onPaymentScheduled(new PaymentScheduledEvent(1L, "CLM-0A0B0C0D", 42L,
                new BigDecimal("500"), LocalDate.of(2026, 11, 1)));

        ArgumentCaptor<NotificationMessage> captor = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationService).deliver(eq(holder), captor.capture());
        assertEquals("Payment Scheduled - Claim CLM-0A0B0C0D", captor.getValue().subject());
        assertTrue(captor.getValue().message().contains("$500.00"));
        assertTrue(captor.getValue().message().contains("2026-11-01"));
    }

    @Test
    public void testOnStatusChanged_unknownPolicyholder_sendsNothing() {
        when(userRepository.findById(99L)).thenReturn(Optional.empty());

        notifier.onStatusChanged(new ClaimStatusChangedEvent(1L, "CLM-1", 99L, ClaimStatus.APPROVED, ClaimStatus.PAID));

        verify(notificationService, never()).deliver(any(), any());
    }

    @Test
    public void testOnClaimSubmitted_deliveryFailure_isSwallowed() {
        doThrow(new IllegalStateException("boom")).when(notificationService).deliver(eq(holder), any());

        assertDoesNotThrow(() -> notifier.onClaimSubmitted(new ClaimSubmittedEvent(1L, "CLM-1", 42L)));
    }

    @Test
    public void testFormatAmount() {
        assertEquals("$1234.50", ClaimEventNotifier.formatAmount(new BigDecimal("1234.5")));
        assertEquals("$0.00", ClaimEventNotifier.formatAmount(null));
    }
}
