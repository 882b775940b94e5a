package com.fieldops.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 批量导入导出配置项。
 */
@Data
@ConfigurationProperties(prefix = "fieldops.bulk")
public class BulkProperties {

    /** 上传文件大小上限（MB） */
    private int maxFileMb = 10;

    /** 每个事务写入的行数 */
    private int chunkSize = 500;

    /** 记录数不超过该值时同步导出，否则转为异步作业 */
    private int exportSyncLimit = 2000;

    /** 预览中保留的样例行数 */
    private int previewRows = 20;

    /** 错误明细接口最多返回的条数 */
    private int maxErrorsListed = 5000;

    /** 作业列表最多返回的条数 */
    private int maxJobsListed = 200;
}
