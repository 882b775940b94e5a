package com.fieldops.web.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.common.exception.NotFoundException;
import com.fieldops.common.exception.StorageException;
import com.fieldops.common.util.IdGenerator;
import com.fieldops.common.util.SqliteTime;
import com.fieldops.tasks.queue.TaskMessage;
import com.fieldops.tasks.queue.TaskQueue;
import com.fieldops.tasks.storage.ObjectStorage;
import com.fieldops.web.bulk.BulkEntityHandler;
import com.fieldops.web.bulk.BulkEntityRegistry;
import com.fieldops.web.bulk.BulkJobStatus;
import com.fieldops.web.bulk.CsvSheets;
import com.fieldops.web.config.BulkProperties;
import com.fieldops.web.dto.ExportJobView;
import com.fieldops.web.entity.ExportJobEntity;
import com.fieldops.web.repository.ExportJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批量导出。记录数不超过同步上限时直接生成文件，否则创建作业交给任务队列。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkExportService {

    public static final String TASK_TYPE = "bulk.export";
    public static final String RESOURCE_TYPE = "export_job";

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final BulkEntityRegistry registry;
    private final ExportJobRepository exportJobRepository;
    private final JdbcAggregateTemplate aggregateTemplate;
    private final ObjectStorage storage;
    private final TaskQueue taskQueue;
    private final AuditService auditService;
    private final BulkProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * 导出某个实体的全部记录（含停用）。
     *
     * @return 同步时为 {url, exported}，异步时为 {jobId, status}
     */
    public Map<String, Object> export(String entity, String userId) {
        BulkEntityHandler handler = registry.get(entity);
        long total = handler.count();
        Map<String, Object> result = new LinkedHashMap<>();

        if (total <= properties.getExportSyncLimit()) {
            GeneratedFile file = generate(handler);
            result.put("url", storage.downloadUrl(file.url));
            result.put("exported", file.rows);
            auditService.record(userId, "bulk.export.completed", RESOURCE_TYPE, null,
                    Map.of("entity", entity, "exported", file.rows, "mode", "sync"));
            log.info("同步导出完成: entity={}, {} 行", entity, file.rows);
            return result;
        }

        ExportJobEntity job = ExportJobEntity.builder()
                .id(IdGenerator.withPrefix("exp"))
                .entity(entity)
                .status(BulkJobStatus.QUEUED.value())
                .templateVersion(handler.config().getTemplateVersion())
                .createdBy(userId)
                .build();
        aggregateTemplate.insert(job);
        auditService.record(userId, "bulk.export.queued", RESOURCE_TYPE, job.getId(),
                Map.of("entity", entity, "total", total));
        taskQueue.enqueue(TaskMessage.of(TASK_TYPE, job.getId()));
        log.info("导出记录数 {} 超过同步上限，已创建作业: {}", total, job.getId());

        result.put("jobId", job.getId());
        result.put("status", job.getStatus());
        return result;
    }

    /**
     * 执行异步导出作业，失败时作业标记为 failed。
     *
     * @return 作业最新状态，作业不存在时返回 null
     */
    public ExportJobEntity run(String jobId) {
        ExportJobEntity job = exportJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("导出作业不存在: {}", jobId);
            return null;
        }
        if (BulkJobStatus.COMPLETED.matches(job.getStatus())) {
            log.info("导出作业已完成，跳过: {}", jobId);
            return job;
        }

        job.setStatus(BulkJobStatus.RUNNING.value());
        job.setStartedAt(SqliteTime.now());
        exportJobRepository.save(job);

        try {
            GeneratedFile file = generate(registry.get(job.getEntity()));
            job.setFileUrl(file.url);
            job.setFileName(file.fileName);
            job.setFileSize(file.size);
            job.setSummaryJson(toJson(Map.of("exported", file.rows)));
            job.setStatus(BulkJobStatus.COMPLETED.value());
            log.info("导出作业完成: jobId={}, {} 行", jobId, file.rows);
        } catch (RuntimeException e) {
            log.error("导出作业失败: jobId={}", jobId, e);
            job.setSummaryJson(toJson(Map.of("error", String.valueOf(e.getMessage()))));
            job.setStatus(BulkJobStatus.FAILED.value());
        }
        job.setFinishedAt(SqliteTime.now());
        exportJobRepository.save(job);
        auditService.record(job.getCreatedBy(), "bulk.export." + job.getStatus(), RESOURCE_TYPE, jobId,
                Map.of("entity", job.getEntity()));
        return job;
    }

    public ExportJobEntity get(String jobId) {
        return exportJobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("EXPORT_JOB_NOT_FOUND", "导出作业不存在: " + jobId));
    }

    public List<ExportJobEntity> list(String entity) {
        return exportJobRepository.search(StringUtils.hasText(entity) ? entity : null, properties.getMaxJobsListed());
    }

    public byte[] download(String jobId) {
        ExportJobEntity job = get(jobId);
        if (job.getFileUrl() == null) {
            throw new NotFoundException("EXPORT_NOT_READY", "导出文件尚未生成，当前状态: " + job.getStatus());
        }
        try (InputStream in = storage.openStream(job.getFileUrl())) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new StorageException("读取导出文件失败", e);
        }
    }

    public ExportJobView toView(ExportJobEntity job) {
        return ExportJobView.builder()
                .id(job.getId())
                .entity(job.getEntity())
                .status(job.getStatus())
                .fileName(job.getFileName())
                .fileSize(job.getFileSize())
                .summary(readJson(job.getSummaryJson()))
                .url(job.getFileUrl() != null ? storage.downloadUrl(job.getFileUrl()) : null)
                .createdBy(job.getCreatedBy())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .build();
    }

    private GeneratedFile generate(BulkEntityHandler handler) {
        List<List<String>> rows = handler.exportRows();
        byte[] content = CsvSheets.write(handler.config().labels(), rows);
        String fileName = handler.entity() + "-" + LocalDateTime.now(ZoneOffset.UTC).format(FILE_TS) + ".csv";
        String url = storage.uploadBytes(content, "bulk/exports/" + handler.entity() + "/" + fileName, "text/csv");
        return new GeneratedFile(url, fileName, content.length, rows.size());
    }

    private String toJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 序列化失败", e);
        }
    }

    private JsonNode readJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("作业 JSON 字段解析失败: {}", e.getMessage());
            return null;
        }
    }

    private static class GeneratedFile {
        private final String url;
        private final String fileName;
        private final long size;
        private final int rows;

        GeneratedFile(String url, String fileName, long size, int rows) {
            this.url = url;
            this.fileName = fileName;
            this.size = size;
            this.rows = rows;
        }
    }
}
