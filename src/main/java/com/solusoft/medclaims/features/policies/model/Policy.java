package com.solusoft.medclaims.features.policies.model;

import java.time.Instant;
import java.time.LocalDate;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("policies")
@Getter
@Setter
@NoArgsConstructor
public class Policy {

    @Id
    private Long id;

    private String memberNumber;
    private String planType;
    private Long policyholderId;
    private Long employerId;
    private LocalDate startDate;
    private LocalDate endDate;
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;
}
