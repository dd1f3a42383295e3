package com.example.coa.infrastructure.process;

import com.example.coa.application.extraction.ExtractionBackend;
import com.example.coa.application.extraction.ExtractionResultMapper;
import com.example.coa.domain.exception.DocumentNotFoundException;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.infrastructure.config.CoaProperties;
import com.example.coa.infrastructure.exception.ExternalParserException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Backend that hands each document to an external parser command.
 * <p>
 * The request goes to stdin as {@code {"pdf_path": ..., "columns": [...], "phase": n}}. Stdout and stderr are
 * redirected to temporary files and read only after the process has exited; stdout must hold one flat JSON object.
 */
@Component
@ConditionalOnProperty(prefix = "coa.extraction", name = "backend", havingValue = "process")
public class ExternalProcessExtractionBackend implements ExtractionBackend {

    private static final Logger log = LoggerFactory.getLogger(ExternalProcessExtractionBackend.class);
    private static final int STDERR_EXCERPT_LENGTH = 500;

    private final ObjectMapper objectMapper;
    private final ExtractionResultMapper resultMapper;
    private final List<String> command;
    private final Duration timeout;

    public ExternalProcessExtractionBackend(ObjectMapper objectMapper,
                                            ExtractionResultMapper resultMapper,
                                            CoaProperties properties) {
        this.objectMapper = objectMapper;
        this.resultMapper = resultMapper;
        this.command = List.copyOf(properties.getExtraction().getProcess().getCommand());
        this.timeout = properties.getExtraction().getProcess().getTimeout();
    }

    @Override
    public ExtractedRecord extract(Path pdf, String originalFileName, List<String> targetColumns, ExtractionPhase phase) {
        if (pdf == null || !Files.exists(pdf)) {
            throw new DocumentNotFoundException(pdf == null ? "<null>" : pdf.toAbsolutePath().toString());
        }
        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("coa-parser-", ".out");
            stderr = Files.createTempFile("coa-parser-", ".err");
            Map<String, Object> flat = run(pdf, originalFileName, targetColumns, phase, stdout, stderr);
            return resultMapper.fromFlatResult(flat, phase, targetColumns);
        } catch (IOException e) {
            throw new ExternalParserException("Unable to run the parser for " + originalFileName, e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private Map<String, Object> run(Path pdf, String fileName, List<String> targetColumns, ExtractionPhase phase,
                                    Path stdout, Path stderr) throws IOException {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("pdf_path", pdf.toAbsolutePath().toString());
        request.put("columns", targetColumns);
        request.put("phase", phase.number());

        Process process = new ProcessBuilder(command)
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile())
                .start();
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(objectMapper.writeValueAsBytes(request));
        } catch (IOException e) {
            // parser may exit before reading its input; the exit status decides
            log.debug("Parser closed stdin early for {}: {}", fileName, e.getMessage());
        }

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExternalParserException("Interrupted while parsing " + fileName, e);
        }
        if (!finished) {
            process.destroyForcibly();
            throw new ExternalParserException("Parser timed out after " + timeout.toSeconds() + "s for " + fileName);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new ExternalParserException("Parser exited with status " + exitCode + " for " + fileName
                    + ": " + excerpt(Files.readString(stderr, StandardCharsets.UTF_8)));
        }
        return parseOutput(Files.readString(stdout, StandardCharsets.UTF_8), fileName);
    }

    private Map<String, Object> parseOutput(String output, String fileName) {
        JsonNode node;
        try {
            node = objectMapper.readTree(output);
        } catch (IOException e) {
            throw new ExternalParserException("Parser output for " + fileName + " is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ExternalParserException("Parser output for " + fileName + " is not a JSON object");
        }
        return objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() { });
    }

    private static String excerpt(String stderr) {
        String trimmed = stderr.strip();
        return trimmed.length() <= STDERR_EXCERPT_LENGTH ? trimmed : trimmed.substring(0, STDERR_EXCERPT_LENGTH) + "...";
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete parser output file {}: {}", file, e.getMessage());
        }
    }
}
