package com.fieldops.common.exception;

/**
 * 资源不存在（或已被其他客户占用，视同不存在）。
 */
public class NotFoundException extends FieldOpsException {

    public NotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
