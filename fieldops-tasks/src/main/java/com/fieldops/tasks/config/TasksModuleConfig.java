package com.fieldops.tasks.config;

import com.fieldops.tasks.queue.InMemoryTaskQueue;
import com.fieldops.tasks.queue.RedisTaskQueue;
import com.fieldops.tasks.queue.TaskDispatcher;
import com.fieldops.tasks.queue.TaskQueue;
import com.fieldops.tasks.storage.LocalObjectStorage;
import com.fieldops.tasks.storage.ObjectStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;

/**
 * 任务模块自动配置。
 * <p>
 * 通过 {@code fieldops.tasks.queue-type} 切换队列实现：
 * <ul>
 *   <li>{@code memory}（默认）：进程内线程池，零外部依赖，适合单机部署</li>
 *   <li>{@code redis}：Redis List 队列，多实例共享，由定时轮询消费</li>
 * </ul>
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.fieldops.tasks")
@EnableConfigurationProperties({TasksProperties.class, StorageProperties.class})
public class TasksModuleConfig {

    // ==================== 队列 ====================

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(name = "fieldops.tasks.queue-type", havingValue = "memory", matchIfMissing = true)
    public TaskQueue inMemoryTaskQueue(TaskDispatcher dispatcher, TasksProperties properties) {
        log.info("使用内存任务队列（{} 个工作线程）", properties.getWorkerThreads());
        return new InMemoryTaskQueue(dispatcher, properties);
    }

    @Bean
    @ConditionalOnProperty(name = "fieldops.tasks.queue-type", havingValue = "redis")
    public TaskQueue redisTaskQueue(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                    TasksProperties properties) {
        log.info("使用 Redis 任务队列: {}", properties.getQueueName());
        return new RedisTaskQueue(redisTemplate, objectMapper, properties);
    }

    // ==================== 存储 ====================

    @Bean
    @ConditionalOnProperty(name = "fieldops.storage.type", havingValue = "local", matchIfMissing = true)
    public ObjectStorage localObjectStorage(StorageProperties properties) {
        Path baseDir = Path.of(properties.getLocalDir()).toAbsolutePath().normalize();
        log.info("使用本地文件存储: {}", baseDir);
        return new LocalObjectStorage(baseDir);
    }
}
