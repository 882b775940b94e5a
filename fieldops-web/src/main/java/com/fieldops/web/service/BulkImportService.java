package com.fieldops.web.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.common.exception.ConflictException;
import com.fieldops.common.exception.NotFoundException;
import com.fieldops.common.exception.StorageException;
import com.fieldops.common.exception.ValidationException;
import com.fieldops.common.util.IdGenerator;
import com.fieldops.common.util.SqliteTime;
import com.fieldops.tasks.queue.TaskMessage;
import com.fieldops.tasks.queue.TaskQueue;
import com.fieldops.tasks.storage.ObjectStorage;
import com.fieldops.tasks.storage.StoredObject;
import com.fieldops.web.bulk.ApplyResult;
import com.fieldops.web.bulk.BulkEntityHandler;
import com.fieldops.web.bulk.BulkEntityRegistry;
import com.fieldops.web.bulk.BulkJobStatus;
import com.fieldops.web.bulk.CsvSheet;
import com.fieldops.web.bulk.CsvSheets;
import com.fieldops.web.bulk.EntityImportConfig;
import com.fieldops.web.bulk.ImportMode;
import com.fieldops.web.bulk.RowErrorCollector;
import com.fieldops.web.bulk.TemplateColumn;
import com.fieldops.web.bulk.ValueNormalizers;
import com.fieldops.web.config.BulkProperties;
import com.fieldops.web.dto.ImportJobView;
import com.fieldops.web.dto.RowErrorView;
import com.fieldops.web.entity.ImportJobEntity;
import com.fieldops.web.entity.ImportRowErrorEntity;
import com.fieldops.web.repository.ImportJobRepository;
import com.fieldops.web.repository.ImportRowErrorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 批量导入流程：上传 → 校验（生成预览与错误报告）→ 确认入队 → 后台分批写入。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkImportService {

    public static final String TASK_TYPE = "bulk.import";
    public static final String RESOURCE_TYPE = "import_job";

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");

    private final BulkEntityRegistry registry;
    private final ImportJobRepository importJobRepository;
    private final ImportRowErrorRepository rowErrorRepository;
    private final JdbcAggregateTemplate aggregateTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectStorage storage;
    private final TaskQueue taskQueue;
    private final AuditService auditService;
    private final BulkProperties properties;
    private final ObjectMapper objectMapper;

    // ==================== 模板 ====================

    public Set<String> entities() {
        return registry.entities();
    }

    /**
     * 导入模板：表头 + 说明行。
     */
    public byte[] template(String entity) {
        EntityImportConfig config = registry.get(entity).config();
        return CsvSheets.write(config.labels(), List.of(config.instructions()));
    }

    // ==================== 上传 ====================

    public ImportJobEntity upload(String entity, MultipartFile file, String modeValue, String userId) {
        BulkEntityHandler handler = registry.get(entity);
        ImportMode mode = ImportMode.from(modeValue);

        String fileName = file.getOriginalFilename();
        if (!StringUtils.hasText(fileName)) {
            throw new ValidationException("FILE_REQUIRED", "未选择文件");
        }
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new ValidationException("UNSUPPORTED_FORMAT", "仅支持 CSV 文件");
        }
        if (file.isEmpty()) {
            throw new ValidationException("EMPTY_FILE", "文件为空");
        }

        String path = "bulk/imports/" + entity + "/"
                + LocalDateTime.now(ZoneOffset.UTC).format(FILE_TS) + "-" + sanitize(fileName);
        long maxBytes = (long) properties.getMaxFileMb() * 1024 * 1024;
        StoredObject stored;
        try (InputStream in = file.getInputStream()) {
            stored = storage.upload(in, path, "text/csv", maxBytes);
        } catch (IOException e) {
            throw new StorageException("读取上传文件失败", e);
        }
        if (stored.getSize() <= 0) {
            throw new ValidationException("EMPTY_FILE", "文件为空");
        }
        checkDuplicate(entity, stored.getSha256());

        ImportJobEntity job = ImportJobEntity.builder()
                .id(IdGenerator.withPrefix("imp"))
                .entity(entity)
                .mode(mode.value())
                .status(BulkJobStatus.QUEUED.value())
                .fileUrl(stored.getUrl())
                .fileName(fileName)
                .fileSize(stored.getSize())
                .fileHash(stored.getSha256())
                .templateVersion(handler.config().getTemplateVersion())
                .createdBy(userId)
                .build();
        aggregateTemplate.insert(job);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("entity", entity);
        payload.put("fileName", fileName);
        payload.put("fileSize", stored.getSize());
        auditService.record(userId, "bulk.import.upload", RESOURCE_TYPE, job.getId(), payload);
        log.info("导入文件已上传: jobId={}, entity={}, file={}, {} 字节", job.getId(), entity, fileName, stored.getSize());
        return get(job.getId());
    }

    private void checkDuplicate(String entity, String fileHash) {
        for (ImportJobEntity existing : importJobRepository.findByEntityAndFileHash(entity, fileHash)) {
            if (BulkJobStatus.COMPLETED.matches(existing.getStatus())) {
                throw new ConflictException("DUPLICATE_IMPORT", "该文件已导入过: " + existing.getId());
            }
            if (BulkJobStatus.isInProgress(existing.getStatus())) {
                throw new ConflictException("IMPORT_IN_PROGRESS", "该文件已有进行中的导入作业: " + existing.getId());
            }
        }
    }

    // ==================== 校验 ====================

    /**
     * 校验导入文件，写入行级错误、预览与汇总。
     * 无错误时作业进入 ready_to_confirm，否则进入 failed 并生成错误报告。
     */
    public ImportJobEntity validate(String jobId, String userId) {
        ImportJobEntity job = get(jobId);
        if (BulkJobStatus.RUNNING.matches(job.getStatus()) || BulkJobStatus.COMPLETED.matches(job.getStatus())) {
            throw new ConflictException("INVALID_JOB_STATE", "作业当前状态不允许重新校验: " + job.getStatus());
        }
        BulkEntityHandler handler = registry.get(job.getEntity());
        EntityImportConfig config = handler.config();
        ImportMode mode = ImportMode.from(job.getMode());

        auditService.record(userId, "bulk.import.validate", RESOURCE_TYPE, jobId, Map.of("entity", job.getEntity()));
        updateStatus(job, BulkJobStatus.VALIDATING);

        CsvSheet sheet;
        List<String> keys;
        try {
            sheet = readSheet(job);
            keys = mapHeader(config, sheet.getHeader());
        } catch (RuntimeException e) {
            updateStatus(job, BulkJobStatus.FAILED);
            throw e;
        }

        RowErrorCollector errors = new RowErrorCollector();
        Set<List<String>> seenKeys = new HashSet<>();
        List<Map<String, Object>> samples = new ArrayList<>();
        int created = 0;
        int updated = 0;
        int skipped = 0;

        for (CsvSheet.Row row : sheet.getRows()) {
            if (row.isBlank()) {
                continue;
            }
            int n = row.getRowNumber();
            Map<String, Object> data = parseRow(config, keys, row, errors);

            for (String key : config.requiredKeys()) {
                if (!data.containsKey(key)) {
                    errors.add(n, key, "必填字段为空: " + config.labelFor(key));
                }
            }
            handler.validate(n, data, errors);

            List<String> uniqueKey = config.resolveUniqueKey(data);
            if (uniqueKey == null) {
                if (config.isUniqueKeyRequired()) {
                    errors.add(n, RowErrorCollector.UNIQUE_FIELD, "缺少唯一键字段");
                }
            } else if (!seenKeys.add(uniqueKey)) {
                errors.add(n, RowErrorCollector.UNIQUE_FIELD, "文件中唯一键重复");
            }

            if (!errors.hasErrors(n)) {
                boolean exists = handler.exists(data);
                if (mode.shouldSkip(exists)) {
                    skipped++;
                } else if (exists) {
                    updated++;
                } else {
                    created++;
                }
                if (samples.size() < properties.getPreviewRows()) {
                    Map<String, Object> sample = new LinkedHashMap<>(data);
                    sample.remove("password");
                    samples.add(sample);
                }
            }
        }

        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("created", created);
        preview.put("updated", updated);
        preview.put("skipped", skipped);
        preview.put("errors", errors.size());
        preview.put("samples", samples);

        replaceRowErrors(jobId, errors);
        job.setPreviewJson(toJson(preview));
        job.setSummaryJson(toJson(summary(created, updated, skipped, errors.size())));
        job.setErrorReportUrl(errors.size() > 0 ? uploadErrorReport(job, sheet, errors) : null);
        job.setStatus(errors.size() == 0 ? BulkJobStatus.READY_TO_CONFIRM.value() : BulkJobStatus.FAILED.value());
        importJobRepository.save(job);

        log.info("导入校验完成: jobId={}, 新建={}, 更新={}, 跳过={}, 错误={}",
                jobId, created, updated, skipped, errors.size());
        return get(jobId);
    }

    // ==================== 确认 ====================

    public ImportJobEntity confirm(String jobId, String userId) {
        ImportJobEntity job = get(jobId);
        if (!BulkJobStatus.READY_TO_CONFIRM.matches(job.getStatus())) {
            throw new ValidationException("JOB_NOT_VALIDATED", "作业尚未通过校验，当前状态: " + job.getStatus());
        }
        if (importJobRepository.countActiveExcluding(job.getEntity(), jobId) > 0) {
            throw new ConflictException("IMPORT_IN_PROGRESS", "该实体已有排队或执行中的导入作业");
        }
        updateStatus(job, BulkJobStatus.QUEUED);
        auditService.record(userId, "bulk.import.confirm", RESOURCE_TYPE, jobId, Map.of("entity", job.getEntity()));
        taskQueue.enqueue(TaskMessage.of(TASK_TYPE, jobId));
        log.info("导入作业已入队: jobId={}", jobId);
        return job;
    }

    // ==================== 执行 ====================

    /**
     * 执行导入。只处理 queued / running 状态的作业，其余状态直接返回。
     * 每批在一个事务中写入；某批失败时回滚并逐行重试，失败的行记为行级错误。
     *
     * @return 作业最新状态，作业不存在时返回 null
     */
    public ImportJobEntity run(String jobId) {
        ImportJobEntity job = importJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("导入作业不存在: {}", jobId);
            return null;
        }
        if (!BulkJobStatus.QUEUED.matches(job.getStatus()) && !BulkJobStatus.RUNNING.matches(job.getStatus())) {
            log.info("导入作业状态为 {}，跳过执行: {}", job.getStatus(), jobId);
            return job;
        }

        BulkEntityHandler handler = registry.get(job.getEntity());
        EntityImportConfig config = handler.config();
        ImportMode mode = ImportMode.from(job.getMode());

        job.setStatus(BulkJobStatus.RUNNING.value());
        if (job.getStartedAt() == null) {
            job.setStartedAt(SqliteTime.now());
        }
        importJobRepository.save(job);

        CsvSheet sheet;
        List<String> keys;
        try {
            sheet = readSheet(job);
            keys = mapHeader(config, sheet.getHeader());
        } catch (RuntimeException e) {
            log.error("导入作业读取文件失败: jobId={}", jobId, e);
            job.setStatus(BulkJobStatus.FAILED.value());
            job.setFinishedAt(SqliteTime.now());
            job.setSummaryJson(toJson(Map.of("error", String.valueOf(e.getMessage()))));
            importJobRepository.save(job);
            return job;
        }

        RowErrorCollector errors = new RowErrorCollector();
        int[] counts = new int[3];
        List<ParsedRow> chunk = new ArrayList<>();
        int chunkSize = Math.max(1, properties.getChunkSize());
        for (CsvSheet.Row row : sheet.getRows()) {
            if (row.isBlank()) {
                continue;
            }
            Map<String, Object> data = parseRow(config, keys, row, errors);
            if (errors.hasErrors(row.getRowNumber())) {
                continue;
            }
            chunk.add(new ParsedRow(row.getRowNumber(), data));
            if (chunk.size() >= chunkSize) {
                applyChunk(handler, mode, chunk, counts, errors);
                chunk.clear();
            }
        }
        if (!chunk.isEmpty()) {
            applyChunk(handler, mode, chunk, counts, errors);
        }

        Map<String, Object> summary = summary(counts[0], counts[1], counts[2], errors.size());
        if (errors.size() > 0) {
            insertRowErrors(jobId, errors);
            job.setErrorReportUrl(uploadErrorReport(job, sheet, errors));
        }
        job.setStatus(BulkJobStatus.COMPLETED.value());
        job.setFinishedAt(SqliteTime.now());
        job.setSummaryJson(toJson(summary));
        importJobRepository.save(job);
        auditService.record(job.getCreatedBy(), "bulk.import.completed", RESOURCE_TYPE, jobId, summary);

        log.info("导入作业完成: jobId={}, 新建={}, 更新={}, 跳过={}, 错误={}",
                jobId, counts[0], counts[1], counts[2], errors.size());
        return job;
    }

    private void applyChunk(BulkEntityHandler handler, ImportMode mode, List<ParsedRow> chunk,
                            int[] counts, RowErrorCollector errors) {
        try {
            int[] chunkCounts = transactionTemplate.execute(status -> {
                int[] c = new int[3];
                for (ParsedRow row : chunk) {
                    c[handler.apply(row.data, mode).ordinal()]++;
                }
                return c;
            });
            for (int i = 0; i < counts.length; i++) {
                counts[i] += chunkCounts[i];
            }
        } catch (RuntimeException e) {
            log.warn("批次写入失败，改为逐行写入（{} 行）: {}", chunk.size(), e.getMessage());
            for (ParsedRow row : chunk) {
                try {
                    ApplyResult result = transactionTemplate.execute(status -> handler.apply(row.data, mode));
                    counts[result.ordinal()]++;
                } catch (RuntimeException rowError) {
                    errors.add(row.rowNumber, null, "写入失败: " + rootMessage(rowError));
                }
            }
        }
    }

    // ==================== 查询 ====================

    public ImportJobEntity get(String jobId) {
        return importJobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("IMPORT_JOB_NOT_FOUND", "导入作业不存在: " + jobId));
    }

    public List<ImportJobEntity> list(String entity, String status) {
        return importJobRepository.search(
                StringUtils.hasText(entity) ? entity : null,
                StringUtils.hasText(status) ? status : null,
                properties.getMaxJobsListed());
    }

    public List<RowErrorView> errors(String jobId) {
        get(jobId);
        return rowErrorRepository.findByJob(jobId, properties.getMaxErrorsListed()).stream()
                .map(RowErrorView::from)
                .toList();
    }

    /**
     * 读取错误报告 CSV 内容。
     */
    public byte[] errorReport(String jobId) {
        ImportJobEntity job = get(jobId);
        if (job.getErrorReportUrl() == null) {
            throw new NotFoundException("ERROR_REPORT_NOT_FOUND", "该作业没有错误报告");
        }
        try (InputStream in = storage.openStream(job.getErrorReportUrl())) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new StorageException("读取错误报告失败", e);
        }
    }

    public ImportJobView toView(ImportJobEntity job) {
        return ImportJobView.builder()
                .id(job.getId())
                .entity(job.getEntity())
                .mode(job.getMode())
                .status(job.getStatus())
                .fileName(job.getFileName())
                .fileSize(job.getFileSize())
                .templateVersion(job.getTemplateVersion())
                .preview(readJson(job.getPreviewJson()))
                .summary(readJson(job.getSummaryJson()))
                .errorReportUrl(job.getErrorReportUrl() != null ? storage.downloadUrl(job.getErrorReportUrl()) : null)
                .createdBy(job.getCreatedBy())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .build();
    }

    // ==================== 内部方法 ====================

    private CsvSheet readSheet(ImportJobEntity job) {
        try (InputStream in = storage.openStream(job.getFileUrl())) {
            return CsvSheets.read(in);
        } catch (IOException e) {
            throw new ValidationException("UNREADABLE_FILE", "无法解析 CSV 文件: " + e.getMessage());
        }
    }

    /**
     * 把表头映射为字段名，无法识别的列映射为 null；缺少必填列时抛出异常。
     */
    private List<String> mapHeader(EntityImportConfig config, List<String> header) {
        Map<String, String> headerMap = config.headerMap();
        List<String> keys = new ArrayList<>(header.size());
        for (String label : header) {
            keys.add(headerMap.get(ValueNormalizers.normalizeHeader(label)));
        }
        List<String> missing = new ArrayList<>();
        for (String key : config.requiredKeys()) {
            if (!keys.contains(key)) {
                missing.add(config.labelFor(key).toUpperCase(Locale.ROOT));
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("MISSING_COLUMNS", "缺少必填列: " + String.join(", ", missing));
        }
        return keys;
    }

    private Map<String, Object> parseRow(EntityImportConfig config, List<String> keys, CsvSheet.Row row,
                                         RowErrorCollector errors) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            String raw = row.cell(i);
            if (key == null || raw.isEmpty()) {
                continue;
            }
            TemplateColumn column = config.column(key).orElseThrow();
            try {
                Object value = column.normalize(raw);
                if (value != null && !value.toString().isEmpty()) {
                    data.put(key, value);
                }
            } catch (IllegalArgumentException e) {
                errors.add(row.getRowNumber(), key, "取值无效: " + column.getLabel());
            }
        }
        return data;
    }

    private void replaceRowErrors(String jobId, RowErrorCollector errors) {
        transactionTemplate.executeWithoutResult(status -> {
            rowErrorRepository.deleteByJob(jobId);
            insertRowErrors(jobId, errors);
        });
    }

    private void insertRowErrors(String jobId, RowErrorCollector errors) {
        if (errors.size() == 0) {
            return;
        }
        List<ImportRowErrorEntity> entities = errors.getErrors().stream()
                .map(e -> ImportRowErrorEntity.builder()
                        .id(IdGenerator.uuid())
                        .importJobId(jobId)
                        .rowNumber(e.getRowNumber())
                        .field(e.getField())
                        .message(e.getMessage())
                        .severity(e.getSeverity())
                        .build())
                .toList();
        aggregateTemplate.insertAll(entities);
    }

    /**
     * 错误报告：原始列 + __status / __error_fields / __messages，只包含有错误的行。
     */
    private String uploadErrorReport(ImportJobEntity job, CsvSheet sheet, RowErrorCollector errors) {
        Map<Integer, List<RowErrorCollector.RowError>> byRow = errors.getErrors().stream()
                .collect(Collectors.groupingBy(RowErrorCollector.RowError::getRowNumber, LinkedHashMap::new,
                        Collectors.toList()));

        List<String> header = new ArrayList<>(sheet.getHeader());
        header.add("__status");
        header.add("__error_fields");
        header.add("__messages");

        List<List<String>> rows = new ArrayList<>();
        for (CsvSheet.Row row : sheet.getRows()) {
            List<RowErrorCollector.RowError> rowErrors = byRow.get(row.getRowNumber());
            if (rowErrors == null) {
                continue;
            }
            List<String> cells = new ArrayList<>();
            for (int i = 0; i < sheet.getHeader().size(); i++) {
                cells.add(row.cell(i));
            }
            Set<String> fields = new TreeSet<>();
            Set<String> messages = new LinkedHashSet<>();
            for (RowErrorCollector.RowError error : rowErrors) {
                if (error.getField() != null) {
                    fields.add(error.getField());
                }
                messages.add(error.getMessage());
            }
            cells.add("ERROR");
            cells.add(String.join(";", fields));
            cells.add(String.join(";", messages));
            rows.add(cells);
        }

        String path = "bulk/errors/" + job.getEntity() + "/" + job.getId() + ".csv";
        return storage.uploadBytes(CsvSheets.write(header, rows), path, "text/csv");
    }

    private void updateStatus(ImportJobEntity job, BulkJobStatus status) {
        job.setStatus(status.value());
        importJobRepository.save(job);
    }

    private static Map<String, Object> summary(int created, int updated, int skipped, int errorsCount) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("created", created);
        summary.put("updated", updated);
        summary.put("skipped", skipped);
        summary.put("errorsCount", errorsCount);
        summary.put("warningsCount", 0);
        return summary;
    }

    private static String sanitize(String fileName) {
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        return base.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage();
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

    private static class ParsedRow {
        private final int rowNumber;
        private final Map<String, Object> data;

        ParsedRow(int rowNumber, Map<String, Object> data) {
            this.rowNumber = rowNumber;
            this.data = data;
        }
    }
}
