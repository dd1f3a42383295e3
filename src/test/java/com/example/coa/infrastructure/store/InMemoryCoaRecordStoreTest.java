package com.example.coa.infrastructure.store;

import com.example.coa.domain.model.CoaRecord;
import com.example.coa.domain.repository.CoaRecordPatch;
import com.example.coa.domain.repository.CoaRecordQuery;
import com.example.coa.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryCoaRecordStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-10T08:00:00Z"));
    private final InMemoryCoaRecordStore store = new InMemoryCoaRecordStore(clock);

    @Test
    void createAssignsIdAndTimestamps() {
        CoaRecord stored = store.create(draft("user-1", "M20253004", "BA001734", Map.of("AV", "19.3")));

        assertThat(stored.id()).isNotBlank();
        assertThat(stored.createdAt()).isEqualTo(clock.instant());
        assertThat(stored.updatedAt()).isEqualTo(clock.instant());
        assertThat(store.findById(stored.id())).contains(stored);
    }

    @Test
    void updateMergesFieldsKeyByKey() {
        CoaRecord stored = store.create(draft("user-1", "M20253004", "BA001734", Map.of("AV", "19.3", "AI", "62.5")));
        clock.advance(Duration.ofMinutes(5));

        CoaRecord updated = store.update(stored.id(), new CoaRecordPatch(
                "second.pdf", null, null, 2, null, Map.of("AV", "20.0", "PC", "25.18"), Map.of("Colour", "amber")));

        assertThat(updated.fields()).containsOnly(entry("AV", "20.0"), entry("AI", "62.5"), entry("PC", "25.18"));
        assertThat(updated.additionalFields()).containsOnly(entry("Colour", "amber"));
        assertThat(updated.fileName()).isEqualTo("second.pdf");
        assertThat(updated.sampleId()).isEqualTo("M20253004");
        assertThat(updated.extractionPhase()).isEqualTo(2);
        assertThat(updated.createdAt()).isEqualTo(stored.createdAt());
        assertThat(updated.updatedAt()).isEqualTo(stored.createdAt().plus(Duration.ofMinutes(5)));
    }

    @Test
    void updateOfUnknownRecordFails() {
        CoaRecordPatch patch = new CoaRecordPatch(null, null, null, null, null, Map.of(), Map.of());

        assertThrows(NoSuchElementException.class, () -> store.update("missing", patch));
    }

    @Test
    void queriesAreScopedToOneUserAndOrderedByCreation() {
        CoaRecord first = store.create(draft("user-1", "M1", "BA000001", Map.of()));
        clock.advance(Duration.ofSeconds(1));
        CoaRecord second = store.create(draft("user-1", "M2", "BA000002", Map.of()));
        clock.advance(Duration.ofSeconds(1));
        store.create(draft("user-2", "M3", "BA000001", Map.of()));
        CoaRecord legacy = store.create(draft(null, "M4", "BA000001", Map.of()));

        assertThat(store.findMany(CoaRecordQuery.forUser("user-1"))).containsExactly(first, second);
        assertThat(store.findMany(CoaRecordQuery.forUser("user-1").withBatchId("BA000001"))).containsExactly(first);
        assertThat(store.findMany(CoaRecordQuery.forUser(null))).containsExactly(legacy);
        assertThat(store.count(CoaRecordQuery.forUser("user-1").createdBetween(first.createdAt().plusMillis(1), null)))
                .isEqualTo(1);
    }

    @Test
    void deleteManyOnlyRemovesMatchingRecords() {
        CoaRecord mine = store.create(draft("user-1", "M1", "BA000001", Map.of()));
        CoaRecord other = store.create(draft("user-2", "M2", "BA000002", Map.of()));

        int deleted = store.deleteMany(CoaRecordQuery.forUser("user-1").withIds(List.of(mine.id(), other.id())));

        assertThat(deleted).isEqualTo(1);
        assertThat(store.findById(mine.id())).isEmpty();
        assertThat(store.findById(other.id())).isPresent();
        assertThat(store.delete(other.id())).isTrue();
        assertThat(store.delete(other.id())).isFalse();
    }

    private static CoaRecord draft(String userId, String sampleId, String batchId, Map<String, String> fields) {
        return new CoaRecord(null, userId, "first.pdf", sampleId, batchId, 1, null, fields, Map.of(), null, null);
    }
}
