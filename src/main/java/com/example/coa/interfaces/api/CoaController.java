package com.example.coa.interfaces.api;

import com.example.coa.application.exception.UseCaseValidationException;
import com.example.coa.application.service.CoaReconciliationService;
import com.example.coa.application.service.CoaRecordService;
import com.example.coa.application.service.CoaUploadService;
import com.example.coa.application.service.ColumnCatalogService;
import com.example.coa.application.service.CsvExportService;
import com.example.coa.application.service.IdentifierResolver;
import com.example.coa.domain.model.BatchUploadResult;
import com.example.coa.domain.model.CoaStatistics;
import com.example.coa.domain.model.DeduplicationReport;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.SampleIdentifiers;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * REST endpoints for COA uploads, stored records, CSV export and identifier diagnostics.
 * The caller is identified by the optional {@value #USER_HEADER} header; requests without it work on unowned records.
 */
@RestController
@RequestMapping("/api/coa")
public class CoaController {

    static final String USER_HEADER = "X-User-Id";
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ColumnCatalogService columnCatalog;
    private final CoaUploadService uploadService;
    private final CoaRecordService recordService;
    private final CoaReconciliationService reconciliationService;
    private final CsvExportService csvExportService;
    private final IdentifierResolver identifierResolver;
    private final Clock clock;

    public CoaController(ColumnCatalogService columnCatalog,
                         CoaUploadService uploadService,
                         CoaRecordService recordService,
                         CoaReconciliationService reconciliationService,
                         CsvExportService csvExportService,
                         IdentifierResolver identifierResolver,
                         Clock clock) {
        this.columnCatalog = columnCatalog;
        this.uploadService = uploadService;
        this.recordService = recordService;
        this.reconciliationService = reconciliationService;
        this.csvExportService = csvExportService;
        this.identifierResolver = identifierResolver;
        this.clock = clock;
    }

	/**
	 * Column names of a phase, or the full definitions for {@code config} and {@code phase1-config}.
	 * Unknown or missing values fall back to phase 1 names.
	 */
    @GetMapping("/columns")
    public Map<String, Object> columns(@RequestParam(value = "phase", required = false) String phase) {
        Map<String, Object> body = new LinkedHashMap<>();
        switch (phase == null ? "" : phase) {
            case "1" -> {
                body.put("columns", columnCatalog.extractionTargets(ExtractionPhase.PHASE_1));
                body.put("phase", 1);
            }
            case "2" -> {
                body.put("columns", columnCatalog.extractionTargets(ExtractionPhase.PHASE_2));
                body.put("phase", 2);
            }
            case "config" -> body.put("columnsConfig", columnCatalog.listColumns());
            case "phase1-config" -> {
                body.put("columnsConfig", columnCatalog.listColumns(ExtractionPhase.PHASE_1));
                body.put("phase", 1);
            }
            default -> {
                body.put("columns", columnCatalog.extractionTargets(ExtractionPhase.PHASE_1));
                body.put("phase", 1);
                body.put("default", true);
            }
        }
        return body;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public BatchUploadResult upload(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                    @RequestParam(value = "phase", required = false) String phase,
                                    @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return uploadService.upload(files, phase, userId);
    }

    @GetMapping("/records")
    public Map<String, Object> records(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        List<Map<String, Object>> records = recordService.listRecords(userId).stream()
                .map(CoaRecordView::flatten)
                .toList();
        return Map.of("records", records);
    }

    @DeleteMapping("/records")
    public Map<String, Object> deleteRecords(@RequestBody DeleteRecordsRequest request,
                                             @RequestHeader(value = USER_HEADER, required = false) String userId) {
        int deleted = recordService.deleteRecords(userId, request.recordIds());
        return Map.of("deletedCount", deleted);
    }

	/**
	 * Streams the given rows as CSV under the reference header row.
	 */
    @PostMapping("/export")
    public ResponseEntity<byte[]> export(@RequestBody ExportRequest request) {
        String csv = csvExportService.exportRows(request.rows());
        String fileName = "coa-export-" + LocalDate.now(clock) + ".csv";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(TEXT_CSV)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping("/stats")
    public CoaStatistics stats(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        return recordService.statistics(userId);
    }

    @PostMapping("/cleanup-duplicates")
    public Map<String, Object> cleanupDuplicates(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        DeduplicationReport report = reconciliationService.deduplicate(userId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Duplicate cleanup completed successfully");
        body.put("mergedRecords", report.mergedRecords());
        body.put("deletedRecords", report.deletedRecords());
        body.put("totalGroupsProcessed", report.totalGroupsProcessed());
        body.put("duplicateGroupsFound", report.duplicateGroupsFound());
        return body;
    }

	/**
	 * Shows how each sample id normalizes and which other inputs it collides with.
	 */
    @PostMapping("/identifiers/normalize")
    public Map<String, Object> normalizeSampleIds(@RequestBody NormalizeRequest request) {
        if (request.sampleIds() == null) {
            throw new UseCaseValidationException("sampleIds must be an array");
        }
        List<String> sampleIds = request.sampleIds();
        List<Map<String, Object>> results = sampleIds.stream()
                .map(sampleId -> {
                    String normalized = identifierResolver.normalizeSampleId(sampleId);
                    List<String> matches = sampleIds.stream()
                            .filter(other -> !Objects.equals(other, sampleId))
                            .filter(other -> Objects.equals(identifierResolver.normalizeSampleId(other), normalized))
                            .toList();
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("original", sampleId);
                    result.put("normalized", normalized);
                    result.put("matches", matches);
                    return result;
                })
                .toList();
        return Map.of("results", results);
    }

    @PostMapping("/identifiers/from-filenames")
    public Map<String, Object> identifiersFromFilenames(@RequestBody FilenamesRequest request) {
        if (request.filenames() == null) {
            throw new UseCaseValidationException("filenames must be an array");
        }
        List<Map<String, Object>> results = request.filenames().stream()
                .map(fileName -> {
                    SampleIdentifiers extracted = identifierResolver.extractFromFilename(fileName);
                    Map<String, Object> normalized = new LinkedHashMap<>();
                    normalized.put("sampleId", identifierResolver.normalizeSampleId(extracted.sampleId()));
                    normalized.put("batchId", identifierResolver.normalizeBatchId(extracted.batchId()));
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("filename", fileName);
                    result.put("extracted", extracted);
                    result.put("normalized", normalized);
                    return result;
                })
                .toList();
        return Map.of("results", results);
    }

    public record DeleteRecordsRequest(List<String> recordIds) {
    }

    public record ExportRequest(List<Map<String, Object>> rows) {
    }

    public record NormalizeRequest(List<String> sampleIds) {
    }

    public record FilenamesRequest(List<String> filenames) {
    }
}
