package com.fieldops.config;

import com.fieldops.web.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 应用启动时按配置创建管理员账号。
 * <p>
 * 配置方式（在 application.yml 中）：
 * fieldops.bootstrap.admin-email / admin-password
 * <p>
 * 或通过环境变量：FIELDOPS_BOOTSTRAP_ADMIN_EMAIL、FIELDOPS_BOOTSTRAP_ADMIN_PASSWORD
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(BootstrapProperties.class)
public class AdminBootstrapInitializer implements CommandLineRunner {

    private final UserService userService;
    private final BootstrapProperties properties;

    @Override
    public void run(String... args) {
        if (!StringUtils.hasText(properties.getAdminEmail()) || !StringUtils.hasText(properties.getAdminPassword())) {
            log.warn("==============================================");
            log.warn("  未配置管理员账号，跳过初始化");
            log.warn("  请设置 fieldops.bootstrap.admin-email / admin-password");
            log.warn("  或通过环境变量: FIELDOPS_BOOTSTRAP_ADMIN_EMAIL");
            log.warn("==============================================");
            return;
        }

        boolean changed = userService.ensureAdmin(properties.getAdminEmail(), properties.getAdminName(),
                properties.getAdminPassword(), properties.isResetPassword());
        if (changed) {
            log.info("管理员账号已就绪: {}", properties.getAdminEmail());
        } else {
            log.info("管理员账号已存在，跳过初始化: {}", properties.getAdminEmail());
        }
    }
}
