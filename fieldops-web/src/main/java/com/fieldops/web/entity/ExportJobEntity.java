package com.fieldops.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 异步导出作业。
 */
@Table("export_jobs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportJobEntity {

    @Id
    private String id;

    private String entity;

    @Builder.Default
    private String status = "queued";

    private String fileUrl;
    private String fileName;
    private Long fileSize;
    private String templateVersion;
    private String summaryJson;
    private String createdBy;

    @ReadOnlyProperty
    private String createdAt;

    private String startedAt;
    private String finishedAt;
}
