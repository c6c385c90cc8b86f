package com.example.archiveuploader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ReportWriter {
    private final ObjectMapper mapper;
    private final Path reportPath;

    /**
     * Writes run reports to a single JSON file.
     */
    public ReportWriter(Path reportPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.reportPath = reportPath;
    }

    /**
     * Writes the report, creating the parent directories if needed.
     */
    public void save(UploadReport report) throws IOException {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
    }

    public Path path() {
        return reportPath;
    }
}
