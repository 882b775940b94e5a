package com.fieldops.web.bulk.handler;

import java.util.Map;

/**
 * 行数据取值工具。
 */
final class BulkRows {

    private BulkRows() {
    }

    /** 取字符串值，缺失或空白时返回 null */
    static String str(Map<String, Object> row, String key) {
        Object value = row.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static Boolean bool(Map<String, Object> row, String key) {
        Object value = row.get(key);
        return value instanceof Boolean ? (Boolean) value : null;
    }

    static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
