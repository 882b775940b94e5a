package com.fieldops.tasks.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 异步任务队列配置项。
 */
@Data
@ConfigurationProperties(prefix = "fieldops.tasks")
public class TasksProperties {

    /** 队列类型: memory（进程内线程池，轻量部署） / redis（分布式） */
    private String queueType = "memory";

    /** 任务在 Redis 中的 List 名 */
    private String queueName = "fieldops:tasks";

    /** 内存队列的工作线程数 */
    private int workerThreads = 2;

    /** Redis 队列的轮询间隔（毫秒） */
    private long pollIntervalMs = 1000;

    /** 每次轮询最多取出的任务数 */
    private int pollBatchSize = 10;

    /** Worker 回调接口的共享密钥，为空时不校验 X-Tasks-Secret */
    private String workerSecret = "";
}
