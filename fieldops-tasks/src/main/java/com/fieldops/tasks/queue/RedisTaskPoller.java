package com.fieldops.tasks.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.tasks.config.TasksProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时任务：从 Redis 队列取出任务并交给 {@link TaskDispatcher} 执行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fieldops.tasks.queue-type", havingValue = "redis")
public class RedisTaskPoller {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TaskDispatcher dispatcher;
    private final TasksProperties properties;

    @Scheduled(fixedDelayString = "${fieldops.tasks.poll-interval-ms:1000}")
    public void poll() {
        int handled = 0;
        String json;
        while (handled < properties.getPollBatchSize()
                && (json = redisTemplate.opsForList().leftPop(properties.getQueueName())) != null) {
            handled++;
            try {
                dispatcher.dispatch(objectMapper.readValue(json, TaskMessage.class));
            } catch (Exception e) {
                log.error("无法解析任务消息，已丢弃: {}", json, e);
            }
        }
        if (handled > 0) {
            log.debug("本轮处理 {} 条 Redis 任务", handled);
        }
    }
}
