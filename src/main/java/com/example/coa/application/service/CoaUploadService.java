package com.example.coa.application.service;

import com.example.coa.application.extraction.ExtractionBackend;
import com.example.coa.application.extraction.ExtractionResultMapper;
import com.example.coa.domain.exception.CoaFilesRequiredException;
import com.example.coa.domain.exception.DomainException;
import com.example.coa.domain.exception.UnsupportedPdfFormatException;
import com.example.coa.domain.model.BatchUploadResult;
import com.example.coa.domain.model.CoaRecord;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.FileProcessingResult;
import com.example.coa.domain.model.FileProcessingStatus;
import com.example.coa.infrastructure.config.CoaProperties;
import com.example.coa.infrastructure.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Processes a batch of uploaded certificates one after another.
 * <p>
 * Each file is written to the upload directory, extracted, reconciled into the record store and removed again.
 * A file that fails at any step is reported in its own result entry; the remaining files are still processed
 * and records stored for earlier files are kept.
 */
@Service
public class CoaUploadService {

    private static final Logger log = LoggerFactory.getLogger(CoaUploadService.class);

    private final ExtractionBackend extractionBackend;
    private final ExtractionResultMapper resultMapper;
    private final ColumnCatalogService columnCatalog;
    private final CoaReconciliationService reconciliation;
    private final CoaProperties properties;

    public CoaUploadService(ExtractionBackend extractionBackend,
                            ExtractionResultMapper resultMapper,
                            ColumnCatalogService columnCatalog,
                            CoaReconciliationService reconciliation,
                            CoaProperties properties) {
        this.extractionBackend = extractionBackend;
        this.resultMapper = resultMapper;
        this.columnCatalog = columnCatalog;
        this.reconciliation = reconciliation;
        this.properties = properties;
    }

	/**
	 * @param files    uploaded files in request order
	 * @param rawPhase phase request parameter, blank means phase 1
	 * @param userId   owning user, may be {@code null}
	 * @return per-file outcome plus totals
	 * @throws CoaFilesRequiredException when no file was uploaded
	 * @throws com.example.coa.domain.exception.InvalidExtractionPhaseException when the phase is not 1 or 2
	 */
    public BatchUploadResult upload(List<MultipartFile> files, String rawPhase, String userId) {
        if (files == null || files.isEmpty()) {
            throw new CoaFilesRequiredException();
        }
        ExtractionPhase phase = ExtractionPhase.parse(rawPhase);
        List<String> targets = columnCatalog.extractionTargets(phase);
        Path uploadDirectory = prepareUploadDirectory();

        List<FileProcessingResult> results = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            results.add(process(file, phase, targets, userId, uploadDirectory));
        }
        BatchUploadResult batch = BatchUploadResult.of(phase, results);
        log.info("Processed {} COA files for user {} (phase {}): {} saved, {} failed",
                batch.totalFiles(), userId, phase.number(), batch.savedToDatabase(), batch.failedFiles());
        return batch;
    }

    private FileProcessingResult process(MultipartFile file, ExtractionPhase phase, List<String> targets,
                                         String userId, Path uploadDirectory) {
        String fileName = resolveFileName(file);
        if (!looksLikePdf(file)) {
            UnsupportedPdfFormatException rejection = new UnsupportedPdfFormatException(fileName);
            log.warn("Rejected upload {}: {}", fileName, rejection.getMessage());
            return FileProcessingResult.failed(fileName, FileProcessingStatus.REJECTED, Map.of(),
                    rejection.reason(), rejection.getMessage());
        }
        if (file.isEmpty()) {
            log.warn("Rejected empty upload {}", fileName);
            return FileProcessingResult.failed(fileName, FileProcessingStatus.REJECTED, Map.of(), "EMPTY_FILE",
                    "The uploaded file is empty.");
        }

        ExtractedRecord extraction;
        try {
            extraction = extract(file, fileName, phase, targets, uploadDirectory);
        } catch (InfrastructureException e) {
            log.warn("Extraction failed for {}: {}", fileName, e.getMessage(), e);
            return extractionFailure(fileName, e.errorCode(), e.getMessage());
        } catch (DomainException e) {
            log.warn("Extraction rejected {}: {}", fileName, e.getMessage());
            return extractionFailure(fileName, e.reason(), e.getMessage());
        } catch (UncheckedIOException e) {
            log.warn("Could not stage upload {}", fileName, e);
            return extractionFailure(fileName, "UPLOAD_IO_ERROR", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected extraction failure for {}", fileName, e);
            return extractionFailure(fileName, "EXTRACTION_ERROR", e.getMessage());
        }

        Map<String, Object> flat = resultMapper.toFlatResult(extraction);
        try {
            CoaRecord saved = reconciliation.upsert(userId, fileName, extraction);
            return FileProcessingResult.persisted(fileName, saved.id(), flat);
        } catch (RuntimeException e) {
            log.error("Failed to persist COA record for {}", fileName, e);
            return FileProcessingResult.failed(fileName, FileProcessingStatus.PERSISTENCE_FAILED, flat,
                    "PERSISTENCE_FAILED", e.getMessage());
        }
    }

    private ExtractedRecord extract(MultipartFile file, String fileName, ExtractionPhase phase, List<String> targets,
                                    Path uploadDirectory) {
        Path staged = null;
        try {
            staged = Files.createTempFile(uploadDirectory, "coa-", ".pdf");
            file.transferTo(staged);
            return extractionBackend.extract(staged, fileName, targets, phase);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to stage " + fileName + " for extraction", e);
        } finally {
            if (staged != null) {
                try {
                    Files.deleteIfExists(staged);
                } catch (IOException e) {
                    log.warn("Could not delete staged upload {}", staged, e);
                }
            }
        }
    }

    private static FileProcessingResult extractionFailure(String fileName, String errorCode, String message) {
        return FileProcessingResult.failed(fileName, FileProcessingStatus.EXTRACTION_FAILED, Map.of(), errorCode, message);
    }

    private Path prepareUploadDirectory() {
        Path directory = properties.getUpload().resolveDirectory();
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create upload directory " + directory, e);
        }
    }

    private static boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private static String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
