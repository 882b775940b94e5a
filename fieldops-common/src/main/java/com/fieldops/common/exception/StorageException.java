package com.fieldops.common.exception;

/**
 * 对象存储读写失败，如文件超限、路径越界、文件不存在。
 */
public class StorageException extends FieldOpsException {

    public StorageException(String message) {
        super("STORAGE_ERROR", message);
    }

    public StorageException(String message, Throwable cause) {
        super("STORAGE_ERROR", message, cause);
    }
}
