package com.fieldops.web.repository;

import com.fieldops.web.entity.WorkOrderEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface WorkOrderRepository extends CrudRepository<WorkOrderEntity, String> {

    @Query("SELECT * FROM work_orders WHERE (:status IS NULL OR status = :status) "
            + "AND (:clientId IS NULL OR client_id = :clientId) AND (:assetId IS NULL OR asset_id = :assetId) "
            + "AND (:includeInactive = 1 OR is_active = 1) ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset")
    List<WorkOrderEntity> search(String status, String clientId, String assetId, boolean includeInactive,
                                 int limit, long offset);

    @Query("SELECT COUNT(*) FROM work_orders WHERE (:status IS NULL OR status = :status) "
            + "AND (:clientId IS NULL OR client_id = :clientId) AND (:assetId IS NULL OR asset_id = :assetId) "
            + "AND (:includeInactive = 1 OR is_active = 1)")
    long countSearch(String status, String clientId, String assetId, boolean includeInactive);

    @Query("SELECT * FROM work_orders ORDER BY created_at, id")
    List<WorkOrderEntity> findAllForExport();
}
