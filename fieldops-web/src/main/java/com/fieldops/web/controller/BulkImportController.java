package com.fieldops.web.controller;

import com.fieldops.common.dto.ApiResponse;
import com.fieldops.web.dto.ImportJobView;
import com.fieldops.web.dto.RowErrorView;
import com.fieldops.web.service.BulkImportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

/**
 * 批量导入 API：模板下载、上传、校验、确认、进度与错误查询。
 */
@RestController
@RequestMapping("/api/bulk")
@RequiredArgsConstructor
public class BulkImportController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final BulkImportService importService;

    @GetMapping("/templates")
    public ApiResponse<Set<String>> entities() {
        return ApiResponse.ok(importService.entities());
    }

    @GetMapping("/templates/{entity}")
    public ResponseEntity<byte[]> template(@PathVariable String entity) {
        return csvAttachment(importService.template(entity), entity + "-template.csv");
    }

    @PostMapping("/import/{entity}/upload")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ImportJobView> upload(@PathVariable String entity,
                                             @RequestParam("file") MultipartFile file,
                                             @RequestParam(defaultValue = "upsert") String mode,
                                             @RequestHeader(value = "X-User-Id", required = false) String userId) {
        return ApiResponse.ok(importService.toView(importService.upload(entity, file, mode, userId)));
    }

    @PostMapping("/import/{jobId}/validate")
    public ApiResponse<ImportJobView> validate(@PathVariable String jobId,
                                               @RequestHeader(value = "X-User-Id", required = false) String userId) {
        return ApiResponse.ok(importService.toView(importService.validate(jobId, userId)));
    }

    @PostMapping("/import/{jobId}/confirm")
    public ApiResponse<ImportJobView> confirm(@PathVariable String jobId,
                                              @RequestHeader(value = "X-User-Id", required = false) String userId) {
        return ApiResponse.ok(importService.toView(importService.confirm(jobId, userId)), "导入作业已提交");
    }

    @GetMapping("/import/{jobId}")
    public ApiResponse<ImportJobView> get(@PathVariable String jobId) {
        return ApiResponse.ok(importService.toView(importService.get(jobId)));
    }

    @GetMapping("/import")
    public ApiResponse<List<ImportJobView>> list(@RequestParam(required = false) String entity,
                                                 @RequestParam(required = false) String status) {
        return ApiResponse.ok(importService.list(entity, status).stream().map(importService::toView).toList());
    }

    @GetMapping("/import/{jobId}/errors")
    public ApiResponse<List<RowErrorView>> errors(@PathVariable String jobId) {
        return ApiResponse.ok(importService.errors(jobId));
    }

    @GetMapping("/import/{jobId}/download-errors")
    public ResponseEntity<byte[]> downloadErrors(@PathVariable String jobId) {
        return csvAttachment(importService.errorReport(jobId), jobId + "-errors.csv");
    }

    static ResponseEntity<byte[]> csvAttachment(byte[] content, String fileName) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(fileName).build().toString())
                .contentType(TEXT_CSV)
                .body(content);
    }
}
