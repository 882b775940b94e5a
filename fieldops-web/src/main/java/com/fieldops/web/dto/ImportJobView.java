package com.fieldops.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 导入作业详情。preview / summary 为作业表中保存的 JSON。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobView {

    private String id;
    private String entity;
    private String mode;
    private String status;
    private String fileName;
    private Long fileSize;
    private String templateVersion;
    private JsonNode preview;
    private JsonNode summary;
    private String errorReportUrl;
    private String createdBy;
    private String createdAt;
    private String startedAt;
    private String finishedAt;
}
