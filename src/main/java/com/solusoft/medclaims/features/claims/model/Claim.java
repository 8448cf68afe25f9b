package com.solusoft.medclaims.features.claims.model;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("claims")
@Getter
@Setter
@NoArgsConstructor
public class Claim {

    @Id
    private Long id;

    private String referenceNumber;
    private Long policyId;
    private String hospitalPharmacy;
    private String reason;
    private BigDecimal requestedAmount;
    private BigDecimal approvedAmount;
    private ClaimStatus status;
    private Instant submissionDate;
    private Instant createdAt;
    private Instant updatedAt;
}
