package com.example.coa.infrastructure.store;

import com.example.coa.domain.model.CoaRecord;
import com.example.coa.domain.repository.CoaRecordPatch;
import com.example.coa.domain.repository.CoaRecordQuery;
import com.example.coa.domain.repository.CoaRecordStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local record store. Every operation is atomic; records are lost on restart.
 */
@Component
public class InMemoryCoaRecordStore implements CoaRecordStore {

    private final Map<String, CoaRecord> records = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryCoaRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized CoaRecord create(CoaRecord draft) {
        Instant now = clock.instant();
        CoaRecord stored = new CoaRecord(
                UUID.randomUUID().toString(),
                draft.userId(),
                draft.fileName(),
                draft.sampleId(),
                draft.batchId(),
                draft.extractionPhase(),
                draft.documentType(),
                draft.fields(),
                draft.additionalFields(),
                now,
                now);
        records.put(stored.id(), stored);
        return stored;
    }

    @Override
    public synchronized Optional<CoaRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized List<CoaRecord> findMany(CoaRecordQuery query) {
        return records.values().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(CoaRecord::createdAt))
                .toList();
    }

    @Override
    public synchronized CoaRecord update(String id, CoaRecordPatch patch) {
        CoaRecord current = records.get(id);
        if (current == null) {
            throw new NoSuchElementException("COA record not found: " + id);
        }
        Map<String, String> fields = new LinkedHashMap<>(current.fields());
        fields.putAll(patch.fields());
        Map<String, Object> additionalFields = new LinkedHashMap<>(current.additionalFields());
        additionalFields.putAll(patch.additionalFields());

        CoaRecord updated = new CoaRecord(
                current.id(),
                current.userId(),
                patch.fileName() != null ? patch.fileName() : current.fileName(),
                patch.sampleId() != null ? patch.sampleId() : current.sampleId(),
                patch.batchId() != null ? patch.batchId() : current.batchId(),
                patch.extractionPhase() != null ? patch.extractionPhase() : current.extractionPhase(),
                patch.documentType() != null ? patch.documentType() : current.documentType(),
                fields,
                additionalFields,
                current.createdAt(),
                clock.instant());
        records.put(id, updated);
        return updated;
    }

    @Override
    public synchronized boolean delete(String id) {
        return records.remove(id) != null;
    }

    @Override
    public synchronized int deleteMany(CoaRecordQuery query) {
        int deleted = 0;
        Iterator<CoaRecord> iterator = records.values().iterator();
        while (iterator.hasNext()) {
            if (query.matches(iterator.next())) {
                iterator.remove();
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized long count(CoaRecordQuery query) {
        return records.values().stream().filter(query::matches).count();
    }
}
