package com.fieldops.web.schema;

import com.fieldops.common.exception.FieldOpsException;

/**
 * 建表脚本执行失败或执行后缺少预期的表，应用不应继续启动。
 */
public class SchemaInitializationException extends FieldOpsException {

    public SchemaInitializationException(String message) {
        super("SCHEMA_INIT_FAILED", message);
    }

    public SchemaInitializationException(String message, Throwable cause) {
        super("SCHEMA_INIT_FAILED", message, cause);
    }
}
