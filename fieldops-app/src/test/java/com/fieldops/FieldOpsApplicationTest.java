package com.fieldops;

import com.fieldops.web.entity.UserEntity;
import com.fieldops.web.schema.SchemaInitializer;
import com.fieldops.web.service.UserService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class FieldOpsApplicationTest extends FieldOpsTestSupport {

    @Autowired
    private SchemaInitializer schemaInitializer;

    @Autowired
    private UserService userService;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Test
    void contextLoads_shouldCreateAllTables() {
        assertThat(schemaInitializer.existingTables())
                .contains("users", "clients", "assets", "work_orders",
                        "import_jobs", "import_row_errors", "export_jobs", "audit_logs");
    }

    @Test
    void schemaApply_shouldBeIdempotent() {
        schemaInitializer.apply();
        schemaInitializer.apply();
        assertThat(schemaInitializer.existingTables()).contains("users");
    }

    @Test
    void adminBootstrap_shouldCreateAdminWithHashedPassword() {
        UserEntity admin = userService.findByEmail("admin@fieldops.test").orElseThrow();

        assertThat(admin.getRole()).isEqualTo(UserService.ADMIN_ROLE);
        assertThat(admin.getPassword()).isNotEqualTo("s3cret-admin");
        assertThat(passwordEncoder.matches("s3cret-admin", admin.getPassword())).isTrue();
        assertThat(passwordEncoder.matches("wrong", admin.getPassword())).isFalse();
    }

    @Test
    void ensureAdmin_shouldNotRecreateExistingAdmin() {
        assertThat(userService.ensureAdmin("admin@fieldops.test", "Other", "another", false)).isFalse();
        assertThat(userService.ensureAdmin("ADMIN@fieldops.test", "Other", "another", false)).isFalse();
    }
}
