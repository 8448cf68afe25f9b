package com.solusoft.medclaims.features.payments.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreatePaymentRequest(
    @NotBlank String invoiceNumber,
    @NotNull @DecimalMin(value = "0.01") BigDecimal paymentAmount,
    @NotNull LocalDate paymentDate,
    PaymentStatus paymentStatus
) {}
