package com.example.coa.domain.model;

import java.util.List;

/**
 * Response of a batch upload. Partial success is a normal outcome.
 *
 * @param phase            phase the batch was extracted with
 * @param totalFiles       number of files received
 * @param savedToDatabase  number of files whose record was created or updated
 * @param failedFiles      number of files that produced no persisted record
 * @param results          per-file details in upload order
 */
public record BatchUploadResult(
        int phase,
        int totalFiles,
        int savedToDatabase,
        int failedFiles,
        List<FileProcessingResult> results
) {

    public static BatchUploadResult of(ExtractionPhase phase, List<FileProcessingResult> results) {
        int saved = (int) results.stream().filter(result -> result.status().isSuccess()).count();
        return new BatchUploadResult(phase.number(), results.size(), saved, results.size() - saved, List.copyOf(results));
    }
}
