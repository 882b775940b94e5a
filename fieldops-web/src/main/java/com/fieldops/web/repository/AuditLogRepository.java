package com.fieldops.web.repository;

import com.fieldops.web.entity.AuditLogEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface AuditLogRepository extends CrudRepository<AuditLogEntity, String> {

    @Query("SELECT * FROM audit_logs WHERE resource_type = :resourceType AND resource_id = :resourceId ORDER BY created_at, id")
    List<AuditLogEntity> findByResource(String resourceType, String resourceId);
}
