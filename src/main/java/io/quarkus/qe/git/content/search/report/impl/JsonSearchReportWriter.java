package io.quarkus.qe.git.content.search.report.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.qe.git.content.search.configuration.AppConfig;
import io.quarkus.qe.git.content.search.logger.Logger;
import io.quarkus.qe.git.content.search.report.SearchReport;
import io.quarkus.qe.git.content.search.report.SearchReportWriter;
import io.quarkus.qe.git.content.search.search.SearchRequest;
import io.quarkus.qe.git.content.search.search.SearchResult;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

/**
 * Writes the search result as JSON to the file given with {@code --result-file}; does nothing otherwise.
 */
@Singleton
final class JsonSearchReportWriter implements SearchReportWriter {

    private final Logger logger;
    private final ObjectMapper objectMapper;
    private String resultFilePath;

    JsonSearchReportWriter(Logger logger) {
        this.logger = logger;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    void updateConfiguration(@Observes AppConfig appConfig) {
        this.resultFilePath = appConfig.resultFilePath();
    }

    @Override
    public void write(SearchRequest request, SearchResult result) {
        if (resultFilePath == null || resultFilePath.isBlank()) {
            return;
        }

        Path resultPath = Paths.get(resultFilePath);
        try {
            if (resultPath.toAbsolutePath().getParent() != null) {
                Files.createDirectories(resultPath.toAbsolutePath().getParent());
            }

            objectMapper.writeValue(resultPath.toFile(), SearchReport.of(request, result, Instant.now()));
            logger.info("Result saved to: " + resultPath.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Failed to write result to file: " + resultFilePath);
            throw new RuntimeException("Failed to write result to file: " + resultFilePath, e);
        }
    }

    SearchReport read(Path resultPath) throws IOException {
        return objectMapper.readValue(resultPath.toFile(), SearchReport.class);
    }
}
