package com.fieldops.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 导出作业详情，完成后 url 为下载地址。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportJobView {

    private String id;
    private String entity;
    private String status;
    private String fileName;
    private Long fileSize;
    private JsonNode summary;
    private String url;
    private String createdBy;
    private String createdAt;
    private String startedAt;
    private String finishedAt;
}
