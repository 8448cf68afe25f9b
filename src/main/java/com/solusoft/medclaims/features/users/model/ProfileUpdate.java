package com.solusoft.medclaims.features.users.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

// a user editing their own record; role and active flag stay with the administrators
public record ProfileUpdate(
    @Email String email,
    @Size(max = 255) String fullName,
    @Size(max = 32) String phone
) {}
