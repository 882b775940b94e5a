package com.fieldops.web.bulk;

import com.fieldops.common.exception.ValidationException;

/**
 * 导入模式。
 */
public enum ImportMode {

    /** 存在则更新，不存在则新建 */
    UPSERT("upsert"),

    /** 只新建，已存在的记录跳过 */
    CREATE_ONLY("create_only"),

    /** 只更新，不存在的记录跳过 */
    UPDATE_ONLY("update_only");

    private final String value;

    ImportMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean shouldSkip(boolean exists) {
        return (this == CREATE_ONLY && exists) || (this == UPDATE_ONLY && !exists);
    }

    public static ImportMode from(String value) {
        if (value == null || value.isBlank()) {
            return UPSERT;
        }
        for (ImportMode mode : values()) {
            if (mode.value.equals(value.trim())) {
                return mode;
            }
        }
        throw new ValidationException("INVALID_MODE", "不支持的导入模式: " + value);
    }
}
