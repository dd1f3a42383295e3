package com.example.coa.application.service;

import com.example.coa.domain.model.CoaRecord;
import com.example.coa.domain.model.DeduplicationReport;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.SampleIdentifiers;
import com.example.coa.domain.repository.CoaRecordPatch;
import com.example.coa.domain.repository.CoaRecordQuery;
import com.example.coa.domain.repository.CoaRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one record per physical sample: an extraction for a known (sample, batch) pair of the same user is
 * merged into the existing record instead of creating a new row.
 * <p>
 * Merges are non-destructive. Only non-null, non-empty incoming values are written, so a value stored earlier
 * never reverts to empty because a later certificate does not report it.
 */
@Service
public class CoaReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(CoaReconciliationService.class);

    private final CoaRecordStore store;
    private final IdentifierResolver identifierResolver;

    public CoaReconciliationService(CoaRecordStore store, IdentifierResolver identifierResolver) {
        this.store = store;
        this.identifierResolver = identifierResolver;
    }

	/**
	 * Creates or updates the record for one extraction.
	 *
	 * @param userId     owning user, {@code null} for anonymous uploads
	 * @param fileName   original upload name, also used as identifier fallback
	 * @param extraction extraction result of the document
	 * @return stored record
	 */
    public CoaRecord upsert(String userId, String fileName, ExtractedRecord extraction) {
        ExtractedRecord resolved = identifierResolver.resolve(extraction, fileName);
        String normalizedSampleId = identifierResolver.normalizeSampleId(resolved.sampleId());
        String normalizedBatchId = identifierResolver.normalizeBatchId(resolved.batchId());

        if (normalizedSampleId == null || normalizedBatchId == null) {
            log.info("Unable to determine sample/batch for {} (sample={}, batch={}); creating standalone record",
                    fileName, resolved.sampleId(), resolved.batchId());
            return store.create(draftOf(userId, fileName, resolved, normalizedBatchId));
        }

        List<CoaRecord> matches = store.findMany(CoaRecordQuery.forUser(userId).withBatchId(normalizedBatchId))
                .stream()
                .filter(record -> normalizedSampleId.equals(identifierResolver.normalizeSampleId(record.sampleId())))
                .toList();
        if (matches.isEmpty()) {
            log.info("Creating COA record: sample={} (normalized {}), batch={}",
                    resolved.sampleId(), normalizedSampleId, normalizedBatchId);
            return store.create(draftOf(userId, fileName, resolved, normalizedBatchId));
        }
        if (matches.size() > 1) {
            log.warn("{} records share sample {} and batch {}; updating the earliest ({})",
                    matches.size(), normalizedSampleId, normalizedBatchId, matches.get(0).id());
        }
        CoaRecord existing = matches.get(0);
        log.info("Updating COA record {}: sample={} (normalized {}), batch={}",
                existing.id(), resolved.sampleId(), normalizedSampleId, normalizedBatchId);
        return store.update(existing.id(), patchOf(fileName, resolved, normalizedBatchId));
    }

	/**
	 * Collapses every group of records of the user that share a normalized (sample, batch) pair into its earliest
	 * record. Values are folded in creation order, so the most recent non-empty value of each key wins.
	 * Records whose identifiers cannot be determined, even from their file name, are left alone.
	 */
    public DeduplicationReport deduplicate(String userId) {
        List<CoaRecord> records = store.findMany(CoaRecordQuery.forUser(userId));
        log.info("Starting duplicate cleanup for user {} over {} records", userId, records.size());

        Map<String, List<KeyedRecord>> groups = new LinkedHashMap<>();
        for (CoaRecord record : records) {
            String sampleId = record.sampleId();
            String batchId = record.batchId();
            if (isBlank(sampleId) || isBlank(batchId)) {
                SampleIdentifiers fromName = identifierResolver.extractFromFilename(record.fileName());
                sampleId = isBlank(sampleId) ? fromName.sampleId() : sampleId;
                batchId = isBlank(batchId) ? fromName.batchId() : batchId;
            }
            String normalizedSampleId = identifierResolver.normalizeSampleId(sampleId);
            String normalizedBatchId = identifierResolver.normalizeBatchId(batchId);
            if (normalizedSampleId == null || normalizedBatchId == null) {
                log.debug("Cleanup skips record {} ({}): no sample/batch", record.id(), record.fileName());
                continue;
            }
            groups.computeIfAbsent(normalizedSampleId + "||" + normalizedBatchId, key -> new ArrayList<>())
                    .add(new KeyedRecord(record, sampleId, batchId));
        }

        int mergedRecords = 0;
        int deletedRecords = 0;
        int duplicateGroups = 0;
        for (Map.Entry<String, List<KeyedRecord>> group : groups.entrySet()) {
            List<KeyedRecord> members = group.getValue();
            if (members.size() <= 1) {
                continue;
            }
            duplicateGroups++;
            KeyedRecord base = members.get(0);
            List<KeyedRecord> duplicates = members.subList(1, members.size());

            CoaRecordPatch patch = foldDuplicates(base, duplicates);
            store.update(base.record().id(), patch);
            mergedRecords++;
            for (KeyedRecord duplicate : duplicates) {
                if (store.delete(duplicate.record().id())) {
                    deletedRecords++;
                }
            }
            log.info("Merged {} duplicates into record {} for {}", duplicates.size(), base.record().id(), group.getKey());
        }
        log.info("Cleanup completed: {} records updated, {} duplicates removed", mergedRecords, deletedRecords);
        return new DeduplicationReport(mergedRecords, deletedRecords, groups.size(), duplicateGroups);
    }

    private CoaRecordPatch foldDuplicates(KeyedRecord base, List<KeyedRecord> duplicates) {
        String sampleId = isBlank(base.record().sampleId()) ? base.sampleId() : null;
        String batchId = isBlank(base.record().batchId()) ? base.batchId() : null;
        String fileName = null;
        Integer extractionPhase = null;
        String documentType = null;
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, Object> additionalFields = new LinkedHashMap<>();

        for (KeyedRecord duplicate : duplicates) {
            CoaRecord record = duplicate.record();
            if (!isBlank(record.sampleId())) {
                sampleId = record.sampleId();
            }
            if (!isBlank(record.batchId())) {
                batchId = record.batchId();
            }
            if (!isBlank(record.fileName())) {
                fileName = record.fileName();
            }
            extractionPhase = record.extractionPhase();
            if (!isBlank(record.documentType())) {
                documentType = record.documentType();
            }
            fields.putAll(nonEmptyFields(record.fields()));
            additionalFields.putAll(nonEmptyValues(record.additionalFields()));
        }
        return new CoaRecordPatch(fileName, sampleId, batchId, extractionPhase, documentType, fields, additionalFields);
    }

    private static CoaRecord draftOf(String userId, String fileName, ExtractedRecord extraction, String batchId) {
        return new CoaRecord(null, userId, fileName, extraction.sampleId(), batchId,
                extraction.extractionPhase().number(), extraction.documentType().displayName(),
                extraction.fields(), extraction.additionalFields(), null, null);
    }

    private static CoaRecordPatch patchOf(String fileName, ExtractedRecord extraction, String batchId) {
        return new CoaRecordPatch(
                fileName,
                isBlank(extraction.sampleId()) ? null : extraction.sampleId(),
                batchId,
                extraction.extractionPhase().number(),
                extraction.documentType().displayName(),
                nonEmptyFields(extraction.fields()),
                nonEmptyValues(extraction.additionalFields()));
    }

    private static Map<String, String> nonEmptyFields(Map<String, String> values) {
        Map<String, String> kept = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (!isBlank(value)) {
                kept.put(key, value);
            }
        });
        return kept;
    }

    private static Map<String, Object> nonEmptyValues(Map<String, Object> values) {
        Map<String, Object> kept = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null && !"".equals(value)) {
                kept.put(key, value);
            }
        });
        return kept;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record KeyedRecord(CoaRecord record, String sampleId, String batchId) {
    }
}
