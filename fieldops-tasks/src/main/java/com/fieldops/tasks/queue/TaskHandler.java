package com.fieldops.tasks.queue;

/**
 * 某一类任务的处理器，由业务模块以 Spring Bean 形式提供。
 */
public interface TaskHandler {

    /** 处理的任务类型 */
    String taskType();

    /**
     * 执行任务。抛出的异常由 {@link TaskDispatcher} 记录，不会中断工作线程。
     */
    void handle(TaskMessage message);
}
