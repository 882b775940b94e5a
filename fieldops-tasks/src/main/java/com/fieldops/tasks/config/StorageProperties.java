package com.fieldops.tasks.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 对象存储配置项。
 */
@Data
@ConfigurationProperties(prefix = "fieldops.storage")
public class StorageProperties {

    /** 存储类型，目前仅支持 local（本地文件系统） */
    private String type = "local";

    /** 本地存储根目录 */
    private String localDir = "storage";
}
