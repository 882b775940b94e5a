package com.fieldops.web.controller;

import com.fieldops.common.dto.ApiResponse;
import com.fieldops.common.dto.PageQuery;
import com.fieldops.common.dto.PageResult;
import com.fieldops.web.dto.WorkOrderCreateRequest;
import com.fieldops.web.dto.WorkOrderUpdateRequest;
import com.fieldops.web.entity.WorkOrderEntity;
import com.fieldops.web.service.WorkOrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * 工单 REST API。
 */
@RestController
@RequestMapping("/api/work-orders")
@RequiredArgsConstructor
public class WorkOrderController {

    private final WorkOrderService workOrderService;

    /**
     * 创建工单。
     *
     * @param userId 请求头 X-User-Id，请求体未指定 createdBy 时作为创建人
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<WorkOrderEntity> create(@Valid @RequestBody WorkOrderCreateRequest request,
                                               @RequestHeader(value = "X-User-Id", required = false) String userId) {
        return ApiResponse.ok(workOrderService.create(request, userId));
    }

    @GetMapping("/{id}")
    public ApiResponse<WorkOrderEntity> get(@PathVariable String id) {
        return ApiResponse.ok(workOrderService.get(id));
    }

    @GetMapping
    public ApiResponse<PageResult<WorkOrderEntity>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String clientId,
            @RequestParam(required = false) String assetId,
            @RequestParam(defaultValue = "false") boolean includeInactive,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {
        return ApiResponse.ok(workOrderService.list(status, clientId, assetId, includeInactive,
                PageQuery.of(page, pageSize)));
    }

    @PatchMapping("/{id}")
    public ApiResponse<WorkOrderEntity> update(@PathVariable String id,
                                               @Valid @RequestBody WorkOrderUpdateRequest request) {
        return ApiResponse.ok(workOrderService.update(id, request));
    }

    @PostMapping("/{id}/close")
    public ApiResponse<WorkOrderEntity> close(@PathVariable String id) {
        return ApiResponse.ok(workOrderService.close(id));
    }

    @PostMapping("/{id}/reopen")
    public ApiResponse<WorkOrderEntity> reopen(@PathVariable String id) {
        return ApiResponse.ok(workOrderService.reopen(id));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<WorkOrderEntity> deactivate(@PathVariable String id) {
        return ApiResponse.ok(workOrderService.setActive(id, false));
    }
}
