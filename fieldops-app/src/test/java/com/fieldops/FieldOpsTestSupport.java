package com.fieldops;

import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 集成测试公共配置：所有测试类共用同一个临时 SQLite 库和存储目录，从而共用 Spring 上下文。
 */
@ActiveProfiles("test")
public abstract class FieldOpsTestSupport {

    private static final Path WORK_DIR = createWorkDir();

    @DynamicPropertySource
    static void fieldOpsProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",
                () -> "jdbc:sqlite:" + WORK_DIR.resolve("fieldops.db") + "?foreign_keys=true&busy_timeout=5000");
        registry.add("fieldops.storage.local-dir", () -> WORK_DIR.resolve("storage").toString());
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("fieldops-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
