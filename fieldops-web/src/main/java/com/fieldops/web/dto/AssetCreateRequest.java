package com.fieldops.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建资产请求，客户 ID 取自路径。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetCreateRequest {

    private String id;

    @NotBlank(message = "资产名称不能为空")
    private String name;

    private String type;
    private String location;

    /** 默认 operating */
    private String status;
}
