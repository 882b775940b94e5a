package com.fieldops.tasks.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.common.exception.FieldOpsException;
import com.fieldops.tasks.config.TasksProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 基于 Redis List 的任务队列。
 * <p>
 * 生产端 RPUSH JSON 消息，消费端由 {@link RedisTaskPoller} 定时 LPOP，
 * 多个实例共享同一个队列，每条消息只会被一个实例取走。
 */
@Slf4j
public class RedisTaskQueue implements TaskQueue {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TasksProperties properties;

    public RedisTaskQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                          TasksProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void enqueue(TaskMessage message) {
        try {
            String json = objectMapper.writeValueAsString(message);
            redisTemplate.opsForList().rightPush(properties.getQueueName(), json);
            log.debug("任务已入队（Redis）: type={}, jobId={}", message.getTaskType(), message.getJobId());
        } catch (JsonProcessingException e) {
            throw new FieldOpsException("TASK_ENQUEUE_FAILED", "任务消息序列化失败", e);
        }
    }

    @Override
    public long pendingCount() {
        Long size = redisTemplate.opsForList().size(properties.getQueueName());
        return size != null ? size : 0;
    }
}
