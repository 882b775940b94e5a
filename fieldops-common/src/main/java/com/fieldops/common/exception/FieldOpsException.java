package com.fieldops.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class FieldOpsException extends RuntimeException {

    private final String errorCode;

    public FieldOpsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FieldOpsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
