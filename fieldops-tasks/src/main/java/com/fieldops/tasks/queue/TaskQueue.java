package com.fieldops.tasks.queue;

/**
 * 异步任务队列接口。
 * <p>
 * 提供两种实现：
 * - {@link InMemoryTaskQueue}：进程内线程池，适合单机部署
 * - {@link RedisTaskQueue}：Redis List，适合多实例部署
 */
public interface TaskQueue {

    /** 投递一条任务 */
    void enqueue(TaskMessage message);

    /** 尚未开始执行的任务数 */
    long pendingCount();
}
