package com.fieldops.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 导入作业。previewJson / summaryJson 以 JSON 文本保存。
 */
@Table("import_jobs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobEntity {

    @Id
    private String id;

    private String entity;

    @Builder.Default
    private String mode = "upsert";

    @Builder.Default
    private String status = "queued";

    private String fileUrl;
    private String fileName;
    private Long fileSize;
    private String fileHash;
    private String templateVersion;
    private String previewJson;
    private String summaryJson;
    private String errorReportUrl;
    private String createdBy;

    @ReadOnlyProperty
    private String createdAt;

    private String startedAt;
    private String finishedAt;
}
