package com.fieldops.tasks.storage;

import java.io.InputStream;

/**
 * 对象存储接口。导入文件、错误报告、导出文件都通过它读写。
 */
public interface ObjectStorage {

    /**
     * 以流的方式上传，同时计算大小和 SHA-256。
     *
     * @param maxBytes 最大字节数，<= 0 表示不限制；超出时抛出 StorageException 且不留下部分文件
     */
    StoredObject upload(InputStream input, String path, String contentType, long maxBytes);

    /** 上传一段完整的字节内容，返回存储地址 */
    String uploadBytes(byte[] content, String path, String contentType);

    /** 打开已存储对象的输入流，调用方负责关闭 */
    InputStream openStream(String url);

    /** 返回可供客户端下载的地址 */
    String downloadUrl(String url);
}
