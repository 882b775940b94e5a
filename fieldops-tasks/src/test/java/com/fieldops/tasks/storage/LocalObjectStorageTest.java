package com.fieldops.tasks.storage;

import com.fieldops.common.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalObjectStorageTest {

    @TempDir
    Path tempDir;

    private LocalObjectStorage storage;

    @BeforeEach
    void setUp() {
        storage = new LocalObjectStorage(tempDir.toAbsolutePath().normalize());
    }

    @Test
    void upload_shouldStoreFileAndComputeHash() throws IOException {
        byte[] content = "hello world".getBytes(StandardCharsets.UTF_8);

        StoredObject stored = storage.upload(new ByteArrayInputStream(content), "imports/a.csv", "text/csv", 0);

        assertThat(stored.getUrl()).startsWith("file:");
        assertThat(stored.getSize()).isEqualTo(content.length);
        assertThat(stored.getSha256())
                .isEqualTo("b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9");
        assertThat(Files.readString(tempDir.resolve("imports/a.csv"))).isEqualTo("hello world");
    }

    @Test
    void upload_shouldRejectOversizeAndRemovePartialFile() {
        byte[] content = new byte[2048];

        assertThatThrownBy(() -> storage.upload(new ByteArrayInputStream(content), "big.csv", "text/csv", 1024))
                .isInstanceOf(StorageException.class);
        assertThat(Files.exists(tempDir.resolve("big.csv"))).isFalse();
    }

    @Test
    void upload_shouldRejectPathOutsideBaseDir() {
        assertThatThrownBy(() -> storage.uploadBytes(new byte[1], "../escape.txt", "text/plain"))
                .isInstanceOf(StorageException.class);
    }

    @Test
    void openStream_shouldReadBackUploadedBytes() throws IOException {
        String url = storage.uploadBytes("a,b\n1,2\n".getBytes(StandardCharsets.UTF_8), "exports/x.csv", "text/csv");

        try (InputStream in = storage.openStream(url)) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("a,b\n1,2\n");
        }
        assertThat(storage.downloadUrl(url)).isEqualTo(url);
    }

    @Test
    void openStream_shouldRejectUnknownScheme() {
        assertThatThrownBy(() -> storage.openStream("gs://bucket/file.csv"))
                .isInstanceOf(StorageException.class);
    }
}
