package com.solusoft.medclaims.events;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PaymentScheduledEvent(
    Long claimId,
    String referenceNumber,
    Long policyholderId,
    BigDecimal amount,
    LocalDate paymentDate
) {}
