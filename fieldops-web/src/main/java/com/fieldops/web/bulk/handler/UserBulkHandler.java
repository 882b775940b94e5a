package com.fieldops.web.bulk.handler;

import com.fieldops.common.util.IdGenerator;
import com.fieldops.web.bulk.ApplyResult;
import com.fieldops.web.bulk.BulkEntityHandler;
import com.fieldops.web.bulk.EntityImportConfig;
import com.fieldops.web.bulk.ImportMode;
import com.fieldops.web.bulk.RowErrorCollector;
import com.fieldops.web.bulk.TemplateColumn;
import com.fieldops.web.bulk.ValueNormalizers;
import com.fieldops.web.entity.UserEntity;
import com.fieldops.web.repository.UserRepository;
import com.fieldops.web.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 用户批量导入导出，以邮箱作为唯一键。导出时不输出密码。
 */
@Component
@RequiredArgsConstructor
public class UserBulkHandler implements BulkEntityHandler {

    private static final EntityImportConfig CONFIG = new EntityImportConfig("users", List.of(
            TemplateColumn.optional("ID", "id", "Optional", ValueNormalizers::text),
            TemplateColumn.required("Name", "name", ValueNormalizers::text),
            TemplateColumn.required("Email", "email", ValueNormalizers::email),
            TemplateColumn.optional("Role", "role", "Optional (default user)", ValueNormalizers::lowerText),
            TemplateColumn.optional("Password", "password", "Optional", ValueNormalizers::text),
            TemplateColumn.optional("Active", "is_active", "Optional (yes/no)", ValueNormalizers::bool)
    ), List.of(List.of("email")), true);

    private final UserRepository userRepository;
    private final JdbcAggregateTemplate aggregateTemplate;
    private final PasswordEncoder passwordEncoder;

    @Override
    public EntityImportConfig config() {
        return CONFIG;
    }

    @Override
    public void validate(int rowNumber, Map<String, Object> row, RowErrorCollector errors) {
        String email = BulkRows.str(row, "email");
        if (email != null && !ValueNormalizers.isValidEmail(email)) {
            errors.add(rowNumber, "email", "邮箱格式不正确");
        }
    }

    @Override
    public boolean exists(Map<String, Object> row) {
        return findExisting(row).isPresent();
    }

    @Override
    public ApplyResult apply(Map<String, Object> row, ImportMode mode) {
        Optional<UserEntity> existing = findExisting(row);
        if (mode.shouldSkip(existing.isPresent())) {
            return ApplyResult.SKIPPED;
        }
        String password = BulkRows.str(row, "password");
        Boolean active = BulkRows.bool(row, "is_active");

        if (existing.isPresent()) {
            UserEntity user = existing.get();
            user.setName(BulkRows.str(row, "name"));
            String role = BulkRows.str(row, "role");
            if (role != null) {
                user.setRole(role);
            }
            if (password != null) {
                user.setPassword(passwordEncoder.encode(password));
            }
            if (active != null) {
                user.setIsActive(active);
            }
            userRepository.save(user);
            return ApplyResult.UPDATED;
        }

        String id = BulkRows.str(row, "id");
        String role = BulkRows.str(row, "role");
        aggregateTemplate.insert(UserEntity.builder()
                .id(id != null ? id : IdGenerator.uuid())
                .name(BulkRows.str(row, "name"))
                .email(BulkRows.str(row, "email"))
                .role(role != null ? role : UserService.DEFAULT_ROLE)
                .password(password != null ? passwordEncoder.encode(password) : null)
                .isActive(active != null ? active : Boolean.TRUE)
                .build());
        return ApplyResult.CREATED;
    }

    @Override
    public long count() {
        return userRepository.count();
    }

    @Override
    public List<List<String>> exportRows() {
        List<List<String>> rows = new ArrayList<>();
        for (UserEntity user : userRepository.findAllForExport()) {
            rows.add(List.of(user.getId(), user.getName(), user.getEmail(), user.getRole(), "",
                    ValueNormalizers.yesNo(user.getIsActive())));
        }
        return rows;
    }

    private Optional<UserEntity> findExisting(Map<String, Object> row) {
        String email = BulkRows.str(row, "email");
        return email == null ? Optional.empty() : userRepository.findByEmail(email);
    }
}
