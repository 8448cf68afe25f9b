package com.solusoft.medclaims.features.providers.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.providers.model.Provider;

public interface ProviderRepository extends ListCrudRepository<Provider, Long> {

    Optional<Provider> findByContactEmail(String contactEmail);

    @Query("SELECT * FROM providers ORDER BY name, id LIMIT :limit OFFSET :offset")
    List<Provider> findPage(@Param("limit") int limit, @Param("offset") long offset);
}
