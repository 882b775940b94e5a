package com.fieldops.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建工单请求。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkOrderCreateRequest {

    private String id;

    @NotBlank(message = "客户 ID 不能为空")
    private String clientId;

    /** 可选，必须属于同一客户 */
    private String assetId;

    @NotBlank(message = "工单标题不能为空")
    private String title;

    private String description;

    /** 默认 open */
    private String status;

    /** 为空时取请求头 X-User-Id */
    private String createdBy;
}
