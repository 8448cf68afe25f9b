package com.solusoft.medclaims.features.claims.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("claim_attachments")
@Getter
@Setter
@NoArgsConstructor
public class ClaimAttachment {

    @Id
    private Long id;

    private Long claimId;
    private String fileName;
    @JsonIgnore
    private String filePath;
    private String fileType;
    private Instant uploadedAt;
}
