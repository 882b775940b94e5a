package com.fieldops.web.controller;

import com.fieldops.common.dto.ApiResponse;
import com.fieldops.common.dto.PageQuery;
import com.fieldops.common.dto.PageResult;
import com.fieldops.web.dto.UserCreateRequest;
import com.fieldops.web.dto.UserResponse;
import com.fieldops.web.dto.UserUpdateRequest;
import com.fieldops.web.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * 用户 REST API。
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<UserResponse> create(@Valid @RequestBody UserCreateRequest request) {
        return ApiResponse.ok(UserResponse.from(userService.create(request)));
    }

    @GetMapping("/{id}")
    public ApiResponse<UserResponse> get(@PathVariable String id) {
        return ApiResponse.ok(UserResponse.from(userService.get(id)));
    }

    @GetMapping
    public ApiResponse<PageResult<UserResponse>> list(
            @RequestParam(required = false) String role,
            @RequestParam(defaultValue = "false") boolean includeInactive,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize) {
        return ApiResponse.ok(userService.list(role, includeInactive, PageQuery.of(page, pageSize))
                .map(UserResponse::from));
    }

    @PatchMapping("/{id}")
    public ApiResponse<UserResponse> update(@PathVariable String id, @Valid @RequestBody UserUpdateRequest request) {
        return ApiResponse.ok(UserResponse.from(userService.update(id, request)));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<UserResponse> deactivate(@PathVariable String id) {
        return ApiResponse.ok(UserResponse.from(userService.setActive(id, false)));
    }

    @PostMapping("/{id}/restore")
    public ApiResponse<UserResponse> restore(@PathVariable String id) {
        return ApiResponse.ok(UserResponse.from(userService.setActive(id, true)));
    }
}
