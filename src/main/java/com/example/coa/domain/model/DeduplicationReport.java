package com.example.coa.domain.model;

/**
 * Summary of a duplicate cleanup run over one user's records.
 */
public record DeduplicationReport(
        int mergedRecords,
        int deletedRecords,
        int totalGroupsProcessed,
        int duplicateGroupsFound
) {
}
