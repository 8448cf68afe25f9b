package com.solusoft.medclaims.features.employers.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("employers")
@Getter
@Setter
@NoArgsConstructor
public class Employer {

    @Id
    private Long id;

    private String name;
    private String contactPerson;
    private String contactEmail;
    private String contactPhone;
    private Instant createdAt;
    private Instant updatedAt;
}
