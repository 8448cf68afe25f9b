package com.solusoft.medclaims.features.employers.repository;

import java.util.List;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.employers.model.Employer;

public interface EmployerRepository extends ListCrudRepository<Employer, Long> {

    @Query("SELECT * FROM employers ORDER BY name, id LIMIT :limit OFFSET :offset")
    List<Employer> findPage(@Param("limit") int limit, @Param("offset") long offset);
}
