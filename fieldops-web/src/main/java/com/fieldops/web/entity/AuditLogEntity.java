package com.fieldops.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 审计日志。
 */
@Table("audit_logs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntity {

    @Id
    private String id;

    private String userId;
    private String action;
    private String resourceType;
    private String resourceId;
    private String payloadJson;

    @ReadOnlyProperty
    private String createdAt;
}
