package com.solusoft.medclaims.features.users.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.users.model.User;

public interface UserRepository extends ListCrudRepository<User, Long> {

    Optional<User> findByEmail(String email);

    @Query("SELECT * FROM users WHERE role = :role AND active = true")
    List<User> findActiveByRole(@Param("role") String role);

    @Query("SELECT * FROM users ORDER BY id LIMIT :limit OFFSET :offset")
    List<User> findPage(@Param("limit") int limit, @Param("offset") long offset);
}
