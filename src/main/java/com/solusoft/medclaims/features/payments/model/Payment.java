package com.solusoft.medclaims.features.payments.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("payments")
@Getter
@Setter
@NoArgsConstructor
public class Payment {

    @Id
    private Long id;

    private Long claimId;
    private String invoiceNumber;
    private BigDecimal paymentAmount;
    private LocalDate paymentDate;
    private PaymentStatus paymentStatus;
    private Long processedById;
    private Instant createdAt;
    private Instant updatedAt;
}
