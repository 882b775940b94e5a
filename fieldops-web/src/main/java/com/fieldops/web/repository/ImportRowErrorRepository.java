package com.fieldops.web.repository;

import com.fieldops.web.entity.ImportRowErrorEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface ImportRowErrorRepository extends CrudRepository<ImportRowErrorEntity, String> {

    @Query("SELECT * FROM import_row_errors WHERE import_job_id = :jobId ORDER BY row_number, field LIMIT :limit")
    List<ImportRowErrorEntity> findByJob(String jobId, int limit);

    @Modifying
    @Query("DELETE FROM import_row_errors WHERE import_job_id = :jobId")
    int deleteByJob(String jobId);
}
