package com.example.coa.application.service;

import com.example.coa.application.exception.UseCaseValidationException;
import com.example.coa.domain.model.CoaRecord;
import com.example.coa.domain.model.CoaStatistics;
import com.example.coa.domain.model.CoaStatistics.MonthlyUploadCount;
import com.example.coa.domain.repository.CoaRecordQuery;
import com.example.coa.infrastructure.store.InMemoryCoaRecordStore;
import com.example.coa.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CoaRecordServiceTest {

    private MutableClock clock;
    private InMemoryCoaRecordStore store;
    private CoaRecordService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-15T10:00:00Z"));
        store = new InMemoryCoaRecordStore(clock);
        service = new CoaRecordService(store, clock);
    }

    @Test
    void listsNewestFirst() {
        CoaRecord older = createAt("2025-01-10T00:00:00Z", "alice", "a.pdf");
        CoaRecord newer = createAt("2025-01-12T00:00:00Z", "alice", "b.pdf");

        assertThat(service.listRecords("alice")).extracting(CoaRecord::id).containsExactly(newer.id(), older.id());
    }

    @Test
    void usersWithoutRecordsSeeUnownedRecords() {
        CoaRecord legacy = createAt("2024-12-01T00:00:00Z", null, "legacy.pdf");
        createAt("2025-01-02T00:00:00Z", "bob", "bob.pdf");

        assertThat(service.listRecords("alice")).extracting(CoaRecord::id).containsExactly(legacy.id());
        assertThat(service.listRecords("bob")).extracting(CoaRecord::fileName).containsExactly("bob.pdf");
    }

    @Test
    void deleteIsScopedToTheUser() {
        CoaRecord own = createAt("2025-01-10T00:00:00Z", "alice", "a.pdf");
        CoaRecord foreign = createAt("2025-01-10T00:00:00Z", "bob", "b.pdf");

        int deleted = service.deleteRecords("alice", List.of(own.id(), foreign.id(), "missing"));

        assertThat(deleted).isEqualTo(1);
        assertThat(store.findById(foreign.id())).isPresent();
    }

    @Test
    void deleteRequiresIds() {
        assertThrows(UseCaseValidationException.class, () -> service.deleteRecords("alice", List.of()));
        assertThrows(UseCaseValidationException.class, () -> service.deleteRecords("alice", null));
    }

    @Test
    void statisticsCoverTheLastSixMonths() {
        createAt("2024-08-20T00:00:00Z", "alice", "aug.pdf");
        createAt("2024-11-03T00:00:00Z", "alice", "nov.pdf");
        createAt("2025-01-01T00:00:00Z", "alice", "jan-1.pdf");
        createAt("2025-01-14T09:00:00Z", "alice", "jan-2.pdf");
        createAt("2025-01-14T09:30:00Z", "bob", "other-user.pdf");
        clock.set(Instant.parse("2025-01-15T10:00:00Z"));

        CoaStatistics statistics = service.statistics("alice");

        assertThat(statistics.totalSamplesThisMonth()).isEqualTo(2);
        assertThat(statistics.totalFiles()).isEqualTo(4);
        assertThat(statistics.lastUploadDate()).isEqualTo(Instant.parse("2025-01-14T09:00:00Z"));
        assertThat(statistics.monthlyUploads()).containsExactly(
                new MonthlyUploadCount("Aug 24", 1),
                new MonthlyUploadCount("Sep 24", 0),
                new MonthlyUploadCount("Oct 24", 0),
                new MonthlyUploadCount("Nov 24", 1),
                new MonthlyUploadCount("Dec 24", 0),
                new MonthlyUploadCount("Jan 25", 2));
    }

    @Test
    void statisticsForUserWithoutRecords() {
        CoaStatistics statistics = service.statistics("nobody");

        assertThat(statistics.totalFiles()).isZero();
        assertThat(statistics.lastUploadDate()).isNull();
        assertThat(statistics.monthlyUploads()).hasSize(6).allMatch(month -> month.uploads() == 0);
        assertThat(store.count(CoaRecordQuery.forUser("nobody"))).isZero();
    }

    private CoaRecord createAt(String instant, String userId, String fileName) {
        clock.set(Instant.parse(instant));
        return store.create(new CoaRecord(null, userId, fileName, null, null, 1, null, Map.of(), Map.of(), null, null));
    }
}
