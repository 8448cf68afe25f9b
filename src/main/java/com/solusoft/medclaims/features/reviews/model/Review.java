package com.solusoft.medclaims.features.reviews.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("reviews")
@Getter
@Setter
@NoArgsConstructor
public class Review {

    @Id
    private Long id;

    private Long claimId;
    private Long reviewerId;
    private ReviewType reviewType;
    private ReviewDecision decision;
    private String comments;
    private String rejectionReason;
    private Instant reviewedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
