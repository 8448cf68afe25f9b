package com.solusoft.medclaims.features.users.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("users")
@Getter
@Setter
@NoArgsConstructor
public class User {

    @Id
    private Long id;

    private String email;
    private String fullName;
    private String phone;
    private Role role;
    private boolean active = true;
    private Instant createdAt;
    private Instant updatedAt;
}
