package com.example.coa.domain.model;

import java.util.Map;

/**
 * Per-file diagnostic entry of a batch upload response.
 *
 * @param fileName   original file name
 * @param status     outcome of the file
 * @param recordId   id of the created or updated record when persisted
 * @param extracted  flat extraction result (reserved keys plus column values), empty when extraction failed
 * @param errorCode  stable failure code, {@code null} on success
 * @param error      human readable failure detail, {@code null} on success
 */
public record FileProcessingResult(
        String fileName,
        FileProcessingStatus status,
        String recordId,
        Map<String, Object> extracted,
        String errorCode,
        String error
) {

    public FileProcessingResult {
        extracted = extracted == null ? Map.of() : extracted;
    }

    public static FileProcessingResult persisted(String fileName, String recordId, Map<String, Object> extracted) {
        return new FileProcessingResult(fileName, FileProcessingStatus.PERSISTED, recordId, extracted, null, null);
    }

    public static FileProcessingResult failed(String fileName, FileProcessingStatus status, Map<String, Object> extracted,
                                              String errorCode, String error) {
        return new FileProcessingResult(fileName, status, null, extracted, errorCode, error);
    }
}
