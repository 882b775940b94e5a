package com.fieldops.tasks.storage;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 上传结果：存储地址、字节数、SHA-256。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredObject {

    private String url;

    private long size;

    /** 十六进制小写 */
    private String sha256;
}
