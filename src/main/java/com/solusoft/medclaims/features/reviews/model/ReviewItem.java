package com.solusoft.medclaims.features.reviews.model;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("review_items")
@Getter
@Setter
@NoArgsConstructor
public class ReviewItem {

    @Id
    private Long id;

    private Long reviewId;
    private String itemName;
    private BigDecimal requestedAmount;
    private BigDecimal approvedAmount;
    private ReviewItemStatus status;
    private String rejectionReason;
    private Instant createdAt;
    private Instant updatedAt;
}
