package com.fieldops.common.exception;

/**
 * 请求参数或文件内容校验失败。
 */
public class ValidationException extends FieldOpsException {

    public ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public ValidationException(String message) {
        super("VALIDATION_FAILED", message);
    }
}
