package com.fieldops.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建客户请求。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientCreateRequest {

    private String id;

    @NotBlank(message = "客户名称不能为空")
    private String name;

    /** CPF/CNPJ，可带标点，入库前只保留数字 */
    private String document;

    private String address;
}
