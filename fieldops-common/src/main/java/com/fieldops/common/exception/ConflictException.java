package com.fieldops.common.exception;

/**
 * 与当前数据状态冲突，如邮箱重复、重复导入、工单已关闭。
 */
public class ConflictException extends FieldOpsException {

    public ConflictException(String errorCode, String message) {
        super(errorCode, message);
    }
}
