package com.fieldops.web.repository;

import com.fieldops.web.entity.ImportJobEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface ImportJobRepository extends CrudRepository<ImportJobEntity, String> {

    @Query("SELECT * FROM import_jobs WHERE entity = :entity AND file_hash = :fileHash ORDER BY created_at DESC, id")
    List<ImportJobEntity> findByEntityAndFileHash(String entity, String fileHash);

    /**
     * 同一实体下其他已确认排队或执行中的作业数。
     * 刚上传、从未校验过的作业也是 queued，但没有 preview_json，不计入。
     */
    @Query("SELECT COUNT(*) FROM import_jobs WHERE entity = :entity AND id <> :excludeId "
            + "AND (status = 'running' OR (status = 'queued' AND preview_json IS NOT NULL))")
    long countActiveExcluding(String entity, String excludeId);

    @Query("SELECT * FROM import_jobs WHERE (:entity IS NULL OR entity = :entity) AND (:status IS NULL OR status = :status) "
            + "ORDER BY created_at DESC, id LIMIT :limit")
    List<ImportJobEntity> search(String entity, String status, int limit);
}
