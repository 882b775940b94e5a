package com.fieldops.web.controller;

import com.fieldops.tasks.queue.TaskQueue;
import com.fieldops.web.schema.SchemaInitializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 健康检查。数据库不可用时返回 503。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SchemaInitializer schemaInitializer;
    private final TaskQueue taskQueue;

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            List<String> tables = schemaInitializer.existingTables();
            body.put("status", "ok");
            body.put("database", "up");
            body.put("tables", tables);
            body.put("pendingTasks", taskQueue.pendingCount());
            return ResponseEntity.ok(body);
        } catch (RuntimeException e) {
            log.warn("健康检查失败: {}", e.getMessage());
            body.put("status", "degraded");
            body.put("database", "down");
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
