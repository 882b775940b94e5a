package com.fieldops.web.schema;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 启动时执行建表脚本。
 * <p>
 * 脚本只包含 CREATE TABLE / CREATE INDEX IF NOT EXISTS，每次启动都执行一遍，
 * 对已初始化的库是空操作。任何失败都会抛出 {@link SchemaInitializationException}，阻止应用启动。
 */
@Slf4j
@Component
public class SchemaInitializer {

    /** 业务表 */
    public static final List<String> DOMAIN_TABLES = List.of("users", "clients", "assets", "work_orders");

    /** 批量导入导出相关表 */
    public static final List<String> BULK_TABLES = List.of("import_jobs", "import_row_errors", "export_jobs", "audit_logs");

    private final DataSource dataSource;
    private final Resource schemaScript;

    public SchemaInitializer(DataSource dataSource, ResourceLoader resourceLoader,
                             @Value("${fieldops.schema.location:classpath:db/schema.sql}") String location) {
        this.dataSource = dataSource;
        this.schemaScript = resourceLoader.getResource(location);
    }

    @PostConstruct
    public void initialize() {
        apply();
        List<String> missing = missingTables();
        if (!missing.isEmpty()) {
            throw new SchemaInitializationException("建表后缺少数据表: " + missing);
        }
        log.info("数据库 Schema 已就绪: {}", existingTables());
    }

    /**
     * 执行建表脚本，可重复调用。
     */
    public void apply() {
        if (!schemaScript.exists()) {
            throw new SchemaInitializationException("找不到建表脚本: " + schemaScript.getDescription());
        }
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(schemaScript);
        populator.setSqlScriptEncoding(StandardCharsets.UTF_8.name());
        populator.setContinueOnError(false);
        try {
            populator.execute(dataSource);
        } catch (RuntimeException e) {
            throw new SchemaInitializationException("执行建表脚本失败: " + e.getMessage(), e);
        }
        log.debug("建表脚本已执行: {}", schemaScript.getDescription());
    }

    /**
     * 当前库中已存在的业务表与批量表（按固定顺序）。
     */
    public List<String> existingTables() {
        Set<String> present = readTableNames();
        List<String> result = new ArrayList<>();
        for (String table : expectedTables()) {
            if (present.contains(table)) {
                result.add(table);
            }
        }
        return result;
    }

    private List<String> missingTables() {
        Set<String> present = readTableNames();
        List<String> missing = new ArrayList<>();
        for (String table : expectedTables()) {
            if (!present.contains(table)) {
                missing.add(table);
            }
        }
        return missing;
    }

    private static List<String> expectedTables() {
        List<String> all = new ArrayList<>(DOMAIN_TABLES);
        all.addAll(BULK_TABLES);
        return all;
    }

    private Set<String> readTableNames() {
        Set<String> names = new HashSet<>();
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            try (ResultSet rs = meta.getTables(null, null, "%", new String[]{"TABLE"})) {
                while (rs.next()) {
                    names.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
                }
            }
        } catch (SQLException e) {
            throw new SchemaInitializationException("读取数据表元数据失败", e);
        }
        return names;
    }
}
