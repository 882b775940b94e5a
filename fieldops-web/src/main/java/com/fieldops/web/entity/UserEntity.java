package com.fieldops.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 用户表。password 仅保存 BCrypt 哈希。
 */
@Table("users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserEntity {

    @Id
    private String id;

    private String name;
    private String email;

    @Builder.Default
    private String role = "user";

    private String password;

    @Builder.Default
    private Boolean isActive = true;

    /** SQLite TEXT 格式（yyyy-MM-dd HH:mm:ss），由数据库默认值填充 */
    @ReadOnlyProperty
    private String createdAt;
}
