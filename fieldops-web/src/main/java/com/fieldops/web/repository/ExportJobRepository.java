package com.fieldops.web.repository;

import com.fieldops.web.entity.ExportJobEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface ExportJobRepository extends CrudRepository<ExportJobEntity, String> {

    @Query("SELECT * FROM export_jobs WHERE (:entity IS NULL OR entity = :entity) ORDER BY created_at DESC, id LIMIT :limit")
    List<ExportJobEntity> search(String entity, int limit);
}
