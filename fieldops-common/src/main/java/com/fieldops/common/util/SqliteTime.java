package com.fieldops.common.util;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * SQLite 时间文本工具。
 * <p>
 * SQLite 的 CURRENT_TIMESTAMP 以 UTC 文本 {@code yyyy-MM-dd HH:mm:ss} 存储，
 * 应用写入的时间列保持同一格式，便于直接按字符串比较和排序。
 */
public final class SqliteTime {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private SqliteTime() {
    }

    public static String now() {
        return format(LocalDateTime.now(ZoneOffset.UTC));
    }

    public static String format(LocalDateTime time) {
        return time == null ? null : time.format(FORMAT);
    }
}
