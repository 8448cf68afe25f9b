package com.solusoft.medclaims.features.payments.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record PaymentView(
    Long id,
    Long claimId,
    String claimReference,
    String invoiceNumber,
    BigDecimal paymentAmount,
    LocalDate paymentDate,
    PaymentStatus paymentStatus,
    Long processedById,
    String processorName,
    Instant createdAt,
    Instant updatedAt
) {

    public static PaymentView of(Payment payment, String claimReference, String processorName) {
        return new PaymentView(payment.getId(), payment.getClaimId(), claimReference, payment.getInvoiceNumber(),
                payment.getPaymentAmount(), payment.getPaymentDate(), payment.getPaymentStatus(),
                payment.getProcessedById(), processorName, payment.getCreatedAt(), payment.getUpdatedAt());
    }
}
