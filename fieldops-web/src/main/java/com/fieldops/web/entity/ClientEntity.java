package com.fieldops.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 客户表。document 为纯数字的 CPF（11 位）或 CNPJ（14 位）。
 */
@Table("clients")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientEntity {

    @Id
    private String id;

    private String name;
    private String document;
    private String address;

    @Builder.Default
    private Boolean isActive = true;

    @ReadOnlyProperty
    private String createdAt;
}
