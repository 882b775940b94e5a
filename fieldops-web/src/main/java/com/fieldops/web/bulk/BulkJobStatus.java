package com.fieldops.web.bulk;

import java.util.EnumSet;
import java.util.Set;

/**
 * 导入/导出作业状态。
 * <p>
 * 导入：queued → validating → ready_to_confirm → (confirm) queued → running → completed，
 * 任一环节出错进入 failed。导出：queued → running → completed / failed。
 */
public enum BulkJobStatus {

    QUEUED("queued"),
    VALIDATING("validating"),
    READY_TO_CONFIRM("ready_to_confirm"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    /** 同一文件处于这些状态时不允许重复上传 */
    public static final Set<BulkJobStatus> IN_PROGRESS = EnumSet.of(QUEUED, VALIDATING, READY_TO_CONFIRM, RUNNING);

    private final String value;

    BulkJobStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean matches(String status) {
        return value.equals(status);
    }

    public static boolean isInProgress(String status) {
        return IN_PROGRESS.stream().anyMatch(s -> s.matches(status));
    }
}
