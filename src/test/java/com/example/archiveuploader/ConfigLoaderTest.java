package com.example.archiveuploader;

import com.example.archiveuploader.store.StoreType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void appliesDefaults() throws Exception {
        Path config = write("""
                {
                  "archiveFile": "site.tar",
                  "destinationPrefix": "/user/stor/site/",
                  "localRoot": "store",
                  "unknownSetting": true
                }
                """);

        UploaderConfig loaded = new ConfigLoader().load(config);

        assertEquals(Path.of("site.tar"), loaded.archiveFile());
        assertEquals("/user/stor/site", loaded.destinationPrefix());
        assertEquals(20, loaded.parallelism());
        assertEquals(2, loaded.copies());
        assertEquals(StoreType.LOCAL, loaded.storeType());
        assertEquals(Path.of("store"), loaded.localRoot().orElseThrow());
        assertTrue(loaded.headers().isEmpty());
        assertTrue(loaded.reportFile().isEmpty());
    }

    @Test
    void readsS3SettingsAndHeaders() throws Exception {
        Path config = write("""
                {
                  "archiveFile": "site.tar.gz",
                  "destinationPrefix": "/backups",
                  "parallelism": 4,
                  "copies": 3,
                  "headers": {"Content-Type": "text/plain", "X-Blank": " "},
                  "storeType": "S3",
                  "s3Bucket": "uploads",
                  "s3Endpoint": "http://localhost:9000",
                  "reportFile": "out/report.json"
                }
                """);

        UploaderConfig loaded = new ConfigLoader().load(config);

        assertEquals(4, loaded.parallelism());
        assertEquals(3, loaded.copies());
        assertEquals(Map.of("content-type", "text/plain"), loaded.headers());
        assertEquals(StoreType.S3, loaded.storeType());
        assertEquals("uploads", loaded.s3Bucket().orElseThrow());
        assertEquals("http://localhost:9000", loaded.s3Endpoint().orElseThrow());
        assertTrue(loaded.s3Region().isEmpty());
        assertEquals(Path.of("out/report.json"), loaded.reportFile().orElseThrow());
    }

    @Test
    void rejectsInvalidConfigs() throws Exception {
        ConfigLoader loader = new ConfigLoader();

        assertThrows(IllegalArgumentException.class, () -> loader.load(write("""
                {"destinationPrefix": "/out", "localRoot": "store"}
                """)));
        assertThrows(IllegalArgumentException.class, () -> loader.load(write("""
                {"archiveFile": "a.tar", "destinationPrefix": "relative", "localRoot": "store"}
                """)));
        assertThrows(IllegalArgumentException.class, () -> loader.load(write("""
                {"archiveFile": "a.tar", "destinationPrefix": "/out"}
                """)));
        assertThrows(IllegalArgumentException.class, () -> loader.load(write("""
                {"archiveFile": "a.tar", "destinationPrefix": "/out", "storeType": "s3"}
                """)));
        assertThrows(IllegalArgumentException.class, () -> loader.load(write("""
                {"archiveFile": "a.tar", "destinationPrefix": "/out", "storeType": "ftp"}
                """)));
    }

    private Path write(String json) throws Exception {
        Path file = Files.createTempFile(tempDir, "config", ".json");
        Files.writeString(file, json);
        return file;
    }
}
