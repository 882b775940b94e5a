package com.fieldops.tasks.queue;

import com.fieldops.tasks.config.TasksProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 基于进程内线程池的任务队列。
 * <p>
 * 任务在提交后由固定数量的工作线程执行，进程退出时未执行的任务会丢失，
 * 作业状态停留在 queued，可通过 Worker 接口重新触发。
 */
@Slf4j
public class InMemoryTaskQueue implements TaskQueue {

    private final TaskDispatcher dispatcher;
    private final ThreadPoolExecutor executor;

    public InMemoryTaskQueue(TaskDispatcher dispatcher, TasksProperties properties) {
        this.dispatcher = dispatcher;
        int threads = Math.max(1, properties.getWorkerThreads());
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("fieldops-task-"));
    }

    @Override
    public void enqueue(TaskMessage message) {
        executor.execute(() -> dispatcher.dispatch(message));
        log.debug("任务已入队（内存）: type={}, jobId={}", message.getTaskType(), message.getJobId());
    }

    @Override
    public long pendingCount() {
        return executor.getQueue().size();
    }

    /**
     * 停止接收新任务，并等待正在执行的任务结束。
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("任务线程池 30 秒内未能结束，强制关闭");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
