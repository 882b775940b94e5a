package com.fieldops.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 修改工单请求，字段为空表示不修改。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkOrderUpdateRequest {

    private String assetId;
    private String title;
    private String description;
    private String status;
}
