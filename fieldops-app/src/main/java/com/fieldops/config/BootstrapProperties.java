package com.fieldops.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 首个管理员账号配置，通常通过环境变量 FIELDOPS_BOOTSTRAP_* 提供。
 */
@Data
@ConfigurationProperties(prefix = "fieldops.bootstrap")
public class BootstrapProperties {

    private String adminEmail = "";

    private String adminName = "Administrator";

    private String adminPassword = "";

    /** 管理员已存在时是否用配置的密码覆盖 */
    private boolean resetPassword = false;
}
