package com.solusoft.medclaims.features.audit.repository;

import java.util.List;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.ListCrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.medclaims.features.audit.model.AuditLog;

public interface AuditLogRepository extends ListCrudRepository<AuditLog, Long> {

    @Query("""
        SELECT * FROM audit_logs
        WHERE (CAST(:entityType AS TEXT) IS NULL OR entity_type = :entityType)
          AND (CAST(:entityId AS BIGINT) IS NULL OR entity_id = :entityId)
          AND (CAST(:userId AS BIGINT) IS NULL OR user_id = :userId)
        ORDER BY created_at DESC, id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<AuditLog> search(@Param("entityType") String entityType,
                          @Param("entityId") Long entityId,
                          @Param("userId") Long userId,
                          @Param("limit") int limit,
                          @Param("offset") long offset);
}
