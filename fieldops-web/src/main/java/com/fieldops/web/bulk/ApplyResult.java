package com.fieldops.web.bulk;

/**
 * 单行导入的结果。
 */
public enum ApplyResult {
    CREATED,
    UPDATED,
    SKIPPED
}
