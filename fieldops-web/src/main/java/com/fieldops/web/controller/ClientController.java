package com.fieldops.web.controller;

import com.fieldops.common.dto.ApiResponse;
import com.fieldops.common.dto.PageQuery;
import com.fieldops.common.dto.PageResult;
import com.fieldops.web.dto.ClientCreateRequest;
import com.fieldops.web.dto.ClientUpdateRequest;
import com.fieldops.web.entity.ClientEntity;
import com.fieldops.web.service.ClientService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * 客户 REST API。
 */
@RestController
@RequestMapping("/api/clients")
@RequiredArgsConstructor
public class ClientController {

    private final ClientService clientService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ClientEntity> create(@Valid @RequestBody ClientCreateRequest request) {
        return ApiResponse.ok(clientService.create(request));
    }

    @GetMapping("/{id}")
    public ApiResponse<ClientEntity> get(@PathVariable String id) {
        return ApiResponse.ok(clientService.get(id));
    }

    @GetMapping
    public ApiResponse<PageResult<ClientEntity>> list(
            @RequestParam(required = false) String document,
            @RequestParam(defaultValue = "false") boolean includeInactive,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {
        return ApiResponse.ok(clientService.list(document, includeInactive, PageQuery.of(page, pageSize)));
    }

    @PatchMapping("/{id}")
    public ApiResponse<ClientEntity> update(@PathVariable String id, @Valid @RequestBody ClientUpdateRequest request) {
        return ApiResponse.ok(clientService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<ClientEntity> deactivate(@PathVariable String id) {
        return ApiResponse.ok(clientService.setActive(id, false));
    }

    @PostMapping("/{id}/restore")
    public ApiResponse<ClientEntity> restore(@PathVariable String id) {
        return ApiResponse.ok(clientService.setActive(id, true));
    }
}
