package com.fieldops.tasks.storage;

import com.fieldops.common.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 本地文件系统存储，返回 file: URI。
 */
@Slf4j
public class LocalObjectStorage implements ObjectStorage {

    private static final int CHUNK_SIZE = 1024 * 1024;

    private final Path baseDir;

    public LocalObjectStorage(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public StoredObject upload(InputStream input, String path, String contentType, long maxBytes) {
        Path target = resolve(path);
        MessageDigest digest = sha256();
        long size = 0;
        try {
            Files.createDirectories(target.getParent());
            try (OutputStream out = Files.newOutputStream(target)) {
                byte[] buffer = new byte[CHUNK_SIZE];
                int read;
                while ((read = input.read(buffer)) != -1) {
                    size += read;
                    if (maxBytes > 0 && size > maxBytes) {
                        break;
                    }
                    digest.update(buffer, 0, read);
                    out.write(buffer, 0, read);
                }
            }
        } catch (IOException e) {
            deleteQuietly(target);
            throw new StorageException("文件写入失败: " + path, e);
        }

        if (maxBytes > 0 && size > maxBytes) {
            deleteQuietly(target);
            throw new StorageException("文件超过大小限制（" + maxBytes + " 字节）");
        }

        String url = target.toUri().toString();
        log.info("文件已保存: {} ({} 字节)", target, size);
        return new StoredObject(url, size, HexFormat.of().formatHex(digest.digest()));
    }

    @Override
    public String uploadBytes(byte[] content, String path, String contentType) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new StorageException("文件写入失败: " + path, e);
        }
        log.info("文件已保存: {} ({} 字节)", target, content.length);
        return target.toUri().toString();
    }

    @Override
    public InputStream openStream(String url) {
        Path file = toPath(url);
        try {
            return Files.newInputStream(file);
        } catch (IOException e) {
            throw new StorageException("文件读取失败: " + url, e);
        }
    }

    @Override
    public String downloadUrl(String url) {
        return url;
    }

    private Path resolve(String path) {
        Path target = baseDir.resolve(path).normalize();
        if (!target.startsWith(baseDir)) {
            throw new StorageException("非法的存储路径: " + path);
        }
        return target;
    }

    private Path toPath(String url) {
        if (url == null || !url.startsWith("file:")) {
            throw new StorageException("不支持的存储地址: " + url);
        }
        Path file = Paths.get(URI.create(url)).normalize();
        if (!file.startsWith(baseDir)) {
            throw new StorageException("存储地址不在存储目录内: " + url);
        }
        return file;
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("清理部分文件失败: {}", file, e);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }
}
