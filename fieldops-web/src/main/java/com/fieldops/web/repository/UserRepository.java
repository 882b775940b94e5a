package com.fieldops.web.repository;

import com.fieldops.web.entity.UserEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface UserRepository extends CrudRepository<UserEntity, String> {

    Optional<UserEntity> findByEmail(String email);

    @Query("SELECT * FROM users WHERE (:role IS NULL OR role = :role) AND (:includeInactive = 1 OR is_active = 1) "
            + "ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset")
    List<UserEntity> search(String role, boolean includeInactive, int limit, long offset);

    @Query("SELECT COUNT(*) FROM users WHERE (:role IS NULL OR role = :role) AND (:includeInactive = 1 OR is_active = 1)")
    long countSearch(String role, boolean includeInactive);

    @Query("SELECT * FROM users ORDER BY created_at, id")
    List<UserEntity> findAllForExport();
}
