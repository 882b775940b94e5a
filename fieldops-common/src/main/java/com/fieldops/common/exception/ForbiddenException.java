package com.fieldops.common.exception;

public class ForbiddenException extends FieldOpsException {

    public ForbiddenException(String message) {
        super("FORBIDDEN", message);
    }
}
