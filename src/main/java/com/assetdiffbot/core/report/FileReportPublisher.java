package com.assetdiffbot.core.report;

import com.assetdiffbot.core.diff.ArtifactLayout;
import com.assetdiffbot.core.model.DiffRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes check-run payloads as JSON next to the job's artifacts, in {@value #FILE_NAME}.
 * Stands in for the platform API client when none is configured.
 */
public class FileReportPublisher implements ReportPublisher {

    private static final Logger log = LoggerFactory.getLogger(FileReportPublisher.class);

    static final String FILE_NAME = "check-run.json";

    private final Path outputRoot;
    private final String fileHostingUrl;
    private final ObjectMapper objectMapper;

    public FileReportPublisher(Path outputRoot, String fileHostingUrl, ObjectMapper objectMapper) {
        this.outputRoot = outputRoot;
        this.fileHostingUrl = fileHostingUrl;
        this.objectMapper = objectMapper;
    }

    @Override
    public void markQueued(DiffRequest request) {
        write(request, basePayload(request, "queued"));
        log.info("Check run queued for {}", request.describe());
    }

    @Override
    public void markStarted(DiffRequest request) {
        var payload = basePayload(request, "in_progress");
        write(request, payload);
        log.info("Check run started for {}", request.describe());
    }

    @Override
    public void reportProgress(DiffRequest request, ReportChunk progress) {
        var payload = basePayload(request, "in_progress");
        payload.put("output", progress);
        write(request, payload);
        log.debug("Progress for {}: {}", request.describe(), progress.title());
    }

    @Override
    public void publish(DiffRequest request, CheckOutputs outputs) {
        var payload = basePayload(request, "completed");
        payload.put("conclusion", "success");
        payload.put("output", outputs.primary());
        payload.put("additional_outputs", outputs.additional());
        write(request, payload);
        log.info("Published report for {} in {} chunk(s)", request.describe(), outputs.all().size());
    }

    @Override
    public void publishFailure(DiffRequest request, ReportChunk failure) {
        var payload = basePayload(request, "completed");
        payload.put("conclusion", "failure");
        payload.put("output", failure);
        write(request, payload);
        log.info("Published failure for {}", request.describe());
    }

    /**
     * Path of the payload file for a request.
     */
    public Path reportFile(DiffRequest request) {
        return ArtifactLayout.forRequest(outputRoot, fileHostingUrl, request).jobRoot().resolve(FILE_NAME);
    }

    private Map<String, Object> basePayload(DiffRequest request, String status) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("repository", request.repo().fullName());
        payload.put("pull_request", request.pullRequest());
        payload.put("head_sha", request.head().sha());
        if (request.checkRunId() != null) {
            payload.put("check_run_id", request.checkRunId());
        }
        payload.put("status", status);
        payload.put("updated_at", Instant.now().toString());
        return payload;
    }

    private void write(DiffRequest request, Map<String, Object> payload) {
        Path file = reportFile(request);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report payload", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
