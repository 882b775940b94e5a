package com.fieldops.web.service;

import com.fieldops.common.dto.PageQuery;
import com.fieldops.common.dto.PageResult;
import com.fieldops.common.exception.ConflictException;
import com.fieldops.common.exception.NotFoundException;
import com.fieldops.common.util.IdGenerator;
import com.fieldops.web.dto.UserCreateRequest;
import com.fieldops.web.dto.UserUpdateRequest;
import com.fieldops.web.entity.UserEntity;
import com.fieldops.web.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * 用户管理。邮箱统一小写存储并保持唯一，密码只保存 BCrypt 哈希。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    public static final String DEFAULT_ROLE = "user";
    public static final String ADMIN_ROLE = "admin";

    private final UserRepository userRepository;
    private final JdbcAggregateTemplate aggregateTemplate;
    private final PasswordEncoder passwordEncoder;

    public UserEntity create(UserCreateRequest request) {
        String email = normalizeEmail(request.getEmail());
        if (userRepository.findByEmail(email).isPresent()) {
            throw new ConflictException("EMAIL_TAKEN", "邮箱已被使用: " + email);
        }
        String id = StringUtils.hasText(request.getId()) ? request.getId().trim() : IdGenerator.uuid();
        if (userRepository.existsById(id)) {
            throw new ConflictException("ID_TAKEN", "用户 ID 已存在: " + id);
        }

        UserEntity user = UserEntity.builder()
                .id(id)
                .name(request.getName().trim())
                .email(email)
                .role(StringUtils.hasText(request.getRole()) ? request.getRole().trim() : DEFAULT_ROLE)
                .password(hash(request.getPassword()))
                .build();
        aggregateTemplate.insert(user);
        log.info("用户已创建: id={}, email={}, role={}", id, email, user.getRole());
        return get(id);
    }

    public UserEntity get(String id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "用户不存在: " + id));
    }

    public Optional<UserEntity> findByEmail(String email) {
        return userRepository.findByEmail(normalizeEmail(email));
    }

    public PageResult<UserEntity> list(String role, boolean includeInactive, PageQuery page) {
        String roleFilter = StringUtils.hasText(role) ? role.trim() : null;
        return page.toResult(
                userRepository.search(roleFilter, includeInactive, page.getPageSize(), page.offset()),
                userRepository.countSearch(roleFilter, includeInactive));
    }

    public UserEntity update(String id, UserUpdateRequest request) {
        UserEntity user = get(id);
        if (StringUtils.hasText(request.getEmail())) {
            String email = normalizeEmail(request.getEmail());
            if (!email.equals(user.getEmail())) {
                userRepository.findByEmail(email).ifPresent(other -> {
                    throw new ConflictException("EMAIL_TAKEN", "邮箱已被使用: " + email);
                });
                user.setEmail(email);
            }
        }
        if (StringUtils.hasText(request.getName())) {
            user.setName(request.getName().trim());
        }
        if (StringUtils.hasText(request.getRole())) {
            user.setRole(request.getRole().trim());
        }
        if (StringUtils.hasText(request.getPassword())) {
            user.setPassword(hash(request.getPassword()));
        }
        userRepository.save(user);
        log.info("用户已更新: id={}", id);
        return get(id);
    }

    public UserEntity setActive(String id, boolean active) {
        UserEntity user = get(id);
        if (!Boolean.valueOf(active).equals(user.getIsActive())) {
            user.setIsActive(active);
            userRepository.save(user);
            log.info("用户已{}: id={}", active ? "恢复" : "停用", id);
        }
        return user;
    }

    /**
     * 启动时确保管理员账号存在。
     *
     * @return true 表示新建或重置了密码
     */
    public boolean ensureAdmin(String email, String name, String password, boolean resetPassword) {
        Optional<UserEntity> existing = findByEmail(email);
        if (existing.isEmpty()) {
            create(UserCreateRequest.builder()
                    .name(StringUtils.hasText(name) ? name : "Administrator")
                    .email(email)
                    .role(ADMIN_ROLE)
                    .password(password)
                    .build());
            return true;
        }
        if (resetPassword && StringUtils.hasText(password)) {
            UserEntity user = existing.get();
            user.setPassword(hash(password));
            userRepository.save(user);
            log.info("管理员密码已重置: {}", user.getEmail());
            return true;
        }
        return false;
    }

    private String hash(String rawPassword) {
        return StringUtils.hasText(rawPassword) ? passwordEncoder.encode(rawPassword) : null;
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
