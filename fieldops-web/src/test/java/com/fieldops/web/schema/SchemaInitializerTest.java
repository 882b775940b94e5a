package com.fieldops.web.schema;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 在临时 SQLite 文件上验证建表脚本：幂等、外键、唯一约束与默认值。
 */
class SchemaInitializerTest {

    @TempDir
    Path tempDir;

    private SchemaInitializer initializer;
    private JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("schema.db").toAbsolutePath());

        initializer = new SchemaInitializer(dataSource, new DefaultResourceLoader(), "classpath:db/schema.sql");
        initializer.initialize();
        jdbc = new JdbcTemplate(dataSource);
    }

    @Test
    void initialize_shouldCreateAllTables() {
        assertThat(initializer.existingTables()).containsExactly(
                "users", "clients", "assets", "work_orders",
                "import_jobs", "import_row_errors", "export_jobs", "audit_logs");
    }

    @Test
    void apply_shouldBeIdempotentAndKeepData() {
        jdbc.update("INSERT INTO clients (id, name) VALUES ('c1', 'Acme')");

        initializer.apply();
        initializer.apply();

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM clients", Integer.class)).isEqualTo(1);
    }

    @Test
    void insertUser_shouldApplyDefaults() {
        jdbc.update("INSERT INTO users (id, name, email) VALUES ('u1', 'Ana', 'ana@example.com')");

        Map<String, Object> row = jdbc.queryForMap("SELECT role, is_active, created_at FROM users WHERE id = 'u1'");
        assertThat(row.get("role")).isEqualTo("user");
        assertThat(((Number) row.get("is_active")).intValue()).isEqualTo(1);
        assertThat(row.get("created_at")).isNotNull();
    }

    @Test
    void insertUser_duplicateEmail_shouldViolateUnique() {
        jdbc.update("INSERT INTO users (id, name, email) VALUES ('u1', 'Ana', 'ana@example.com')");

        assertThatThrownBy(() ->
                jdbc.update("INSERT INTO users (id, name, email) VALUES ('u2', 'Other', 'ana@example.com')"))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("UNIQUE");
    }

    @Test
    void insertAsset_unknownClient_shouldViolateForeignKey() {
        assertThatThrownBy(() ->
                jdbc.update("INSERT INTO assets (id, client_id, name) VALUES ('a1', 'missing', 'Pump')"))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("FOREIGN KEY");
    }

    @Test
    void insertWorkOrder_shouldDefaultStatusAndOpenedAt() {
        jdbc.update("INSERT INTO clients (id, name) VALUES ('c1', 'Acme')");
        jdbc.update("INSERT INTO assets (id, client_id, name) VALUES ('a1', 'c1', 'Pump')");
        jdbc.update("INSERT INTO work_orders (id, client_id, asset_id, title) VALUES ('w1', 'c1', 'a1', 'Leak')");

        Map<String, Object> row = jdbc.queryForMap(
                "SELECT status, opened_at, closed_at FROM work_orders WHERE id = 'w1'");
        assertThat(row.get("status")).isEqualTo("open");
        assertThat(row.get("opened_at")).isNotNull();
        assertThat(row.get("closed_at")).isNull();

        Map<String, Object> asset = jdbc.queryForMap("SELECT status FROM assets WHERE id = 'a1'");
        assertThat(asset.get("status")).isEqualTo("operating");
    }

    @Test
    void insertWorkOrder_unknownAsset_shouldViolateForeignKey() {
        jdbc.update("INSERT INTO clients (id, name) VALUES ('c1', 'Acme')");

        assertThatThrownBy(() ->
                jdbc.update("INSERT INTO work_orders (id, client_id, asset_id, title) VALUES ('w1', 'c1', 'nope', 'Leak')"))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("FOREIGN KEY");
    }

    @Test
    void initialize_missingScript_shouldFail() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("other.db").toAbsolutePath());
        SchemaInitializer broken = new SchemaInitializer(dataSource, new DefaultResourceLoader(),
                "classpath:db/missing.sql");

        assertThatThrownBy(broken::initialize).isInstanceOf(SchemaInitializationException.class);
    }
}
