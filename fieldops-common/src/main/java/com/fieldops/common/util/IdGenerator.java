package com.fieldops.common.util;

import java.util.UUID;

/**
 * ID 生成器工具类。
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    /**
     * 标准 UUID 字符串，作为业务表主键（主键由应用侧生成，不使用自增）。
     */
    public static String uuid() {
        return UUID.randomUUID().toString();
    }

    /**
     * 生成短 UUID（去掉连字符）。
     */
    public static String shortUuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * 生成带前缀的 ID，如 "imp-xxxx", "exp-xxxx"。
     */
    public static String withPrefix(String prefix) {
        return prefix + "-" + shortUuid().substring(0, 12);
    }
}
