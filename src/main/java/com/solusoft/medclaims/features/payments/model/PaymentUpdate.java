package com.solusoft.medclaims.features.payments.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.DecimalMin;

public record PaymentUpdate(
    String invoiceNumber,
    @DecimalMin(value = "0.01") BigDecimal paymentAmount,
    LocalDate paymentDate,
    PaymentStatus paymentStatus
) {}
