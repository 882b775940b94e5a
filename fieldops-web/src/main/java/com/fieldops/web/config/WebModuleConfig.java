package com.fieldops.web.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Web 模块配置。
 */
@Configuration
@ComponentScan(basePackages = "com.fieldops.web")
@EnableConfigurationProperties(BulkProperties.class)
public class WebModuleConfig {

    /**
     * 注册 SQLite 方言：Spring Data JDBC 内置不认识 SQLite，需手动提供。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
