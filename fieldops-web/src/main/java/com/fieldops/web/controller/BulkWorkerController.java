package com.fieldops.web.controller;

import com.fieldops.common.exception.ForbiddenException;
import com.fieldops.tasks.config.TasksProperties;
import com.fieldops.web.entity.ExportJobEntity;
import com.fieldops.web.entity.ImportJobEntity;
import com.fieldops.web.service.BulkExportService;
import com.fieldops.web.service.BulkImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 外部任务调度器回调的 Worker 接口，直接执行指定作业。
 * 配置了 worker-secret 时要求请求头 X-Tasks-Secret 与之一致。
 */
@Slf4j
@RestController
@RequestMapping("/api/bulk/worker")
@RequiredArgsConstructor
public class BulkWorkerController {

    private final BulkImportService importService;
    private final BulkExportService exportService;
    private final TasksProperties tasksProperties;

    @PostMapping("/import/{jobId}")
    public Map<String, String> runImport(@PathVariable String jobId,
                                         @RequestHeader(value = "X-Tasks-Secret", required = false) String secret) {
        checkSecret(secret);
        ImportJobEntity job = importService.run(jobId);
        return Map.of("status", job != null ? job.getStatus() : "not_found");
    }

    @PostMapping("/export/{jobId}")
    public Map<String, String> runExport(@PathVariable String jobId,
                                         @RequestHeader(value = "X-Tasks-Secret", required = false) String secret) {
        checkSecret(secret);
        ExportJobEntity job = exportService.run(jobId);
        return Map.of("status", job != null ? job.getStatus() : "not_found");
    }

    private void checkSecret(String secret) {
        String expected = tasksProperties.getWorkerSecret();
        if (StringUtils.hasText(expected) && !expected.equals(secret)) {
            log.warn("Worker 请求密钥不匹配");
            throw new ForbiddenException("无效的 Worker 密钥");
        }
    }
}
