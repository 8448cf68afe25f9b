package com.solusoft.medclaims.security.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.security.model.ApiKeyEntity;

public interface ApiKeyRepository extends CrudRepository<ApiKeyEntity, Long> {

    @Query("SELECT * FROM api_keys WHERE key_hash = :hash AND active = true")
    Optional<ApiKeyEntity> findByHash(@Param("hash") String hash);

    @Query("SELECT * FROM api_keys WHERE user_id = :userId AND active = true")
    List<ApiKeyEntity> findActiveByUser(@Param("userId") Long userId);
}
