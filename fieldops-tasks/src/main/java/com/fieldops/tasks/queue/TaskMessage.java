package com.fieldops.tasks.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 队列中的一条任务消息：任务类型 + 关联的作业 ID。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskMessage {

    /** 任务类型，如 bulk.import / bulk.export */
    private String taskType;

    /** 作业 ID */
    private String jobId;

    /** 入队时间（epoch 毫秒） */
    private long enqueuedAt;

    public static TaskMessage of(String taskType, String jobId) {
        return new TaskMessage(taskType, jobId, System.currentTimeMillis());
    }
}
