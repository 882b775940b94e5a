package com.fieldops.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.ReadOnlyProperty;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 导入校验/执行时记录的行级错误。
 */
@Table("import_row_errors")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportRowErrorEntity {

    @Id
    private String id;

    private String importJobId;

    /** 源文件中的行号（表头为第 1 行） */
    private Integer rowNumber;

    private String field;
    private String message;

    @Builder.Default
    private String severity = "error";

    @ReadOnlyProperty
    private String createdAt;
}
