package com.fieldops.web.controller;

import com.fieldops.common.dto.ApiResponse;
import com.fieldops.web.dto.ExportJobView;
import com.fieldops.web.entity.ExportJobEntity;
import com.fieldops.web.service.BulkExportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 批量导出 API。
 */
@RestController
@RequestMapping("/api/bulk/export")
@RequiredArgsConstructor
public class BulkExportController {

    private final BulkExportService exportService;

    @GetMapping("/{entity}")
    public ApiResponse<Map<String, Object>> export(@PathVariable String entity,
                                                   @RequestHeader(value = "X-User-Id", required = false) String userId) {
        return ApiResponse.ok(exportService.export(entity, userId));
    }

    @GetMapping("/jobs")
    public ApiResponse<List<ExportJobView>> list(@RequestParam(required = false) String entity) {
        return ApiResponse.ok(exportService.list(entity).stream().map(exportService::toView).toList());
    }

    @GetMapping("/jobs/{jobId}")
    public ApiResponse<ExportJobView> get(@PathVariable String jobId) {
        return ApiResponse.ok(exportService.toView(exportService.get(jobId)));
    }

    @GetMapping("/jobs/{jobId}/download")
    public ResponseEntity<byte[]> download(@PathVariable String jobId) {
        ExportJobEntity job = exportService.get(jobId);
        return BulkImportController.csvAttachment(exportService.download(jobId), job.getFileName());
    }
}
