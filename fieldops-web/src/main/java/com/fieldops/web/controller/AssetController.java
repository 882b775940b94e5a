package com.fieldops.web.controller;

import com.fieldops.common.dto.ApiResponse;
import com.fieldops.common.dto.PageQuery;
import com.fieldops.common.dto.PageResult;
import com.fieldops.web.dto.AssetCreateRequest;
import com.fieldops.web.dto.AssetUpdateRequest;
import com.fieldops.web.entity.AssetEntity;
import com.fieldops.web.service.AssetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * 资产 REST API，挂在客户路径之下。
 */
@RestController
@RequestMapping("/api/clients/{clientId}/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetService assetService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<AssetEntity> create(@PathVariable String clientId,
                                           @Valid @RequestBody AssetCreateRequest request) {
        return ApiResponse.ok(assetService.create(clientId, request));
    }

    @GetMapping("/{assetId}")
    public ApiResponse<AssetEntity> get(@PathVariable String clientId, @PathVariable String assetId) {
        return ApiResponse.ok(assetService.get(clientId, assetId));
    }

    @GetMapping
    public ApiResponse<PageResult<AssetEntity>> list(
            @PathVariable String clientId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "false") boolean includeInactive,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {
        return ApiResponse.ok(assetService.list(clientId, status, includeInactive, PageQuery.of(page, pageSize)));
    }

    @PatchMapping("/{assetId}")
    public ApiResponse<AssetEntity> update(@PathVariable String clientId, @PathVariable String assetId,
                                           @Valid @RequestBody AssetUpdateRequest request) {
        return ApiResponse.ok(assetService.update(clientId, assetId, request));
    }

    @DeleteMapping("/{assetId}")
    public ApiResponse<AssetEntity> deactivate(@PathVariable String clientId, @PathVariable String assetId) {
        return ApiResponse.ok(assetService.setActive(clientId, assetId, false));
    }

    @PostMapping("/{assetId}/restore")
    public ApiResponse<AssetEntity> restore(@PathVariable String clientId, @PathVariable String assetId) {
        return ApiResponse.ok(assetService.setActive(clientId, assetId, true));
    }
}
