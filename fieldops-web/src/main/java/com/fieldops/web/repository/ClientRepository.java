package com.fieldops.web.repository;

import com.fieldops.web.entity.ClientEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface ClientRepository extends CrudRepository<ClientEntity, String> {

    /** 同一证件号可能存在多条（停用后重建），优先取启用中的 */
    @Query("SELECT * FROM clients WHERE document = :document ORDER BY is_active DESC, created_at LIMIT 1")
    Optional<ClientEntity> findFirstByDocument(String document);

    @Query("SELECT * FROM clients WHERE (:document IS NULL OR document = :document) AND (:includeInactive = 1 OR is_active = 1) "
            + "ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset")
    List<ClientEntity> search(String document, boolean includeInactive, int limit, long offset);

    @Query("SELECT COUNT(*) FROM clients WHERE (:document IS NULL OR document = :document) AND (:includeInactive = 1 OR is_active = 1)")
    long countSearch(String document, boolean includeInactive);

    @Query("SELECT * FROM clients ORDER BY created_at, id")
    List<ClientEntity> findAllForExport();
}
