package com.fieldops.web.repository;

import com.fieldops.web.entity.AssetEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface AssetRepository extends CrudRepository<AssetEntity, String> {

    @Query("SELECT * FROM assets WHERE client_id = :clientId AND name = :name ORDER BY is_active DESC, created_at LIMIT 1")
    Optional<AssetEntity> findFirstByClientIdAndName(String clientId, String name);

    @Query("SELECT * FROM assets WHERE client_id = :clientId AND (:status IS NULL OR status = :status) "
            + "AND (:includeInactive = 1 OR is_active = 1) ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset")
    List<AssetEntity> search(String clientId, String status, boolean includeInactive, int limit, long offset);

    @Query("SELECT COUNT(*) FROM assets WHERE client_id = :clientId AND (:status IS NULL OR status = :status) "
            + "AND (:includeInactive = 1 OR is_active = 1)")
    long countSearch(String clientId, String status, boolean includeInactive);

    @Query("SELECT * FROM assets ORDER BY created_at, id")
    List<AssetEntity> findAllForExport();
}
