package com.example.archiveuploader;

import com.example.archiveuploader.store.StoreType;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_PARALLELISM = 20;
    private static final int DEFAULT_COPIES = 2;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public UploaderConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.archiveFile == null || raw.archiveFile.isBlank()) {
            throw new IllegalArgumentException("Config must include archiveFile.");
        }
        String destinationPrefix = normalizePrefix(raw.destinationPrefix);

        int parallelism = raw.parallelism != null && raw.parallelism > 0
                ? raw.parallelism
                : DEFAULT_PARALLELISM;
        int copies = raw.copies != null && raw.copies > 0
                ? raw.copies
                : DEFAULT_COPIES;

        StoreType storeType = StoreType.parse(raw.storeType);
        Optional<Path> localRoot = optionalString(raw.localRoot).map(Path::of);
        Optional<String> s3Bucket = optionalString(raw.s3Bucket);
        Optional<String> s3Region = optionalString(raw.s3Region);
        Optional<String> s3Endpoint = optionalString(raw.s3Endpoint);
        if (storeType == StoreType.LOCAL && localRoot.isEmpty()) {
            throw new IllegalArgumentException("localRoot is required when storeType is local.");
        }
        if (storeType == StoreType.S3 && s3Bucket.isEmpty()) {
            throw new IllegalArgumentException("s3Bucket is required when storeType is s3.");
        }

        return new UploaderConfig(
                Path.of(raw.archiveFile),
                destinationPrefix,
                parallelism,
                copies,
                normalizeHeaders(raw.headers),
                storeType,
                localRoot,
                s3Bucket,
                s3Region,
                s3Endpoint,
                optionalString(raw.reportFile).map(Path::of)
        );
    }

    static String normalizePrefix(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Config must include destinationPrefix.");
        }
        String trimmed = raw.trim();
        if (!trimmed.startsWith("/")) {
            throw new IllegalArgumentException("destinationPrefix must be an absolute path: " + raw);
        }
        return trimmed.replaceAll("/+$", "");
    }

    private Map<String, String> normalizeHeaders(Map<String, String> headers) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name == null || name.isBlank() || value == null || value.isBlank()) {
                    return;
                }
                normalized.put(name.trim().toLowerCase(Locale.ROOT), value.trim());
            });
        }
        return Map.copyOf(normalized);
    }

    private Optional<String> optionalString(String value) {
        return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }

    private static class RawConfig {
        public String archiveFile;
        public String destinationPrefix;
        public Integer parallelism;
        public Integer copies;
        public Map<String, String> headers;
        public String storeType;
        public String localRoot;
        public String s3Bucket;
        public String s3Region;
        public String s3Endpoint;
        public String reportFile;
    }
}
