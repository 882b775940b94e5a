package com.fieldops.tasks.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 任务分发器：按任务类型找到对应的 {@link TaskHandler} 并执行。
 * <p>
 * 处理器在分发时才解析，业务处理器本身可以再依赖 {@link TaskQueue} 投递后续任务。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskDispatcher {

    private final ObjectProvider<TaskHandler> handlers;

    /**
     * 执行一条任务消息。
     *
     * @return true 表示找到处理器且执行成功
     */
    public boolean dispatch(TaskMessage message) {
        Optional<TaskHandler> handler = findHandler(message.getTaskType());
        if (handler.isEmpty()) {
            log.warn("未找到任务处理器: type={}, jobId={}", message.getTaskType(), message.getJobId());
            return false;
        }

        long waited = System.currentTimeMillis() - message.getEnqueuedAt();
        log.info("开始执行任务: type={}, jobId={}, 排队 {}ms", message.getTaskType(), message.getJobId(), waited);
        try {
            handler.get().handle(message);
            return true;
        } catch (Exception e) {
            log.error("任务执行失败: type={}, jobId={}", message.getTaskType(), message.getJobId(), e);
            return false;
        }
    }

    private Optional<TaskHandler> findHandler(String taskType) {
        return handlers.orderedStream()
                .filter(h -> h.taskType().equals(taskType))
                .findFirst();
    }
}
