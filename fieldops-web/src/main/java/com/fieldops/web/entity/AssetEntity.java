package com.fieldops.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 设备/资产表，归属于某个客户。
 */
@Table("assets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetEntity {

    @Id
    private String id;

    private String clientId;
    private String name;
    private String type;
    private String location;

    @Builder.Default
    private String status = "operating";

    @Builder.Default
    private Boolean isActive = true;

    @ReadOnlyProperty
    private String createdAt;
}
