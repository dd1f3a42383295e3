package com.example.coa.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the COA service, bound from the {@code coa.*} properties.
 */
@ConfigurationProperties(prefix = "coa")
public class CoaProperties {

    private static final Logger log = LoggerFactory.getLogger(CoaProperties.class);

    public static final String PDFBOX_BACKEND = "pdfbox";
    public static final String PROCESS_BACKEND = "process";

    private final ReferenceHeaders referenceHeaders = new ReferenceHeaders();
    private final Extraction extraction = new Extraction();
    private final Upload upload = new Upload();

    @PostConstruct
    public void validateAndLog() {
        String backend = extraction.getBackend();
        if (!PDFBOX_BACKEND.equals(backend) && !PROCESS_BACKEND.equals(backend)) {
            throw new IllegalStateException("coa.extraction.backend must be 'pdfbox' or 'process', was: " + backend);
        }
        if (PROCESS_BACKEND.equals(backend) && extraction.getProcess().getCommand().isEmpty()) {
            throw new IllegalStateException("coa.extraction.process.command is required for the process backend");
        }
        if (extraction.getProcess().getTimeout().isNegative() || extraction.getProcess().getTimeout().isZero()) {
            throw new IllegalStateException("coa.extraction.process.timeout must be positive");
        }
        if (referenceHeaders.getHeaderRowOffset() < 0) {
            throw new IllegalStateException("coa.reference-headers.header-row-offset must not be negative");
        }
        log.info("COA extraction backend: {}", backend);
        log.info("Reference header workbook: {}", referenceHeaders.getPath() == null ? "(none, built-in headers)" : referenceHeaders.getPath());
        log.info("Upload directory: {}", upload.resolveDirectory());
    }

    public ReferenceHeaders getReferenceHeaders() {
        return referenceHeaders;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public Upload getUpload() {
        return upload;
    }

    public static class ReferenceHeaders {
        /** Workbook (.xlsx/.xlsm) holding the export header row; built-in headers are used when unset. */
        private Path path;
        /** Rows between the first used row of the sheet and the header row. */
        private int headerRowOffset = 2;

        public Path getPath() {
            return path;
        }

        public void setPath(Path path) {
            this.path = path;
        }

        public int getHeaderRowOffset() {
            return headerRowOffset;
        }

        public void setHeaderRowOffset(int headerRowOffset) {
            this.headerRowOffset = headerRowOffset;
        }
    }

    public static class Extraction {
        private String backend = PDFBOX_BACKEND;
        private final ParserProcess process = new ParserProcess();

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public ParserProcess getProcess() {
            return process;
        }
    }

    public static class ParserProcess {
        /** Parser command line, e.g. {@code python3,/opt/coa/parse_coa_pdf.py}. */
        private List<String> command = new ArrayList<>();
        private Duration timeout = Duration.ofSeconds(60);

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command == null ? new ArrayList<>() : new ArrayList<>(command);
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Upload {
        private Path directory;

        public Path getDirectory() {
            return directory;
        }

        public void setDirectory(Path directory) {
            this.directory = directory;
        }

        public Path resolveDirectory() {
            return directory != null ? directory : Path.of(System.getProperty("java.io.tmpdir"), "coa-uploads");
        }
    }
}
