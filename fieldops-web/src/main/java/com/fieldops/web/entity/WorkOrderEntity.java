package com.fieldops.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 工单表：客户必填，资产可选。
 */
@Table("work_orders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkOrderEntity {

    @Id
    private String id;

    private String clientId;
    private String assetId;
    private String title;
    private String description;

    @Builder.Default
    private String status = "open";

    /** 由数据库默认值填充 */
    @ReadOnlyProperty
    private String openedAt;

    /** 进入 closed 状态时写入，离开时清空 */
    private String closedAt;

    private String createdBy;

    @Builder.Default
    private Boolean isActive = true;

    @ReadOnlyProperty
    private String createdAt;
}
