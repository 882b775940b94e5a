package com.fieldops.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 修改资产请求，字段为空表示不修改。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetUpdateRequest {

    private String name;
    private String type;
    private String location;
    private String status;
}
