package com.example.coa.domain.repository;

import com.example.coa.domain.model.CoaRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Filter understood by every {@link CoaRecordStore}. Queries are always scoped to one user;
 * a {@code null} user id selects the legacy rows that predate record ownership.
 *
 * @param userId         owning user or {@code null} for unowned rows
 * @param batchId        exact stored batch id, ignored when {@code null}
 * @param ids            record ids to restrict to, ignored when {@code null}
 * @param createdFrom    inclusive lower creation bound, ignored when {@code null}
 * @param createdBefore  exclusive upper creation bound, ignored when {@code null}
 */
public record CoaRecordQuery(
        String userId,
        String batchId,
        Set<String> ids,
        Instant createdFrom,
        Instant createdBefore
) {

    public CoaRecordQuery {
        ids = ids == null ? null : Set.copyOf(ids);
    }

    public static CoaRecordQuery forUser(String userId) {
        return new CoaRecordQuery(userId, null, null, null, null);
    }

    public CoaRecordQuery withBatchId(String value) {
        return new CoaRecordQuery(userId, value, ids, createdFrom, createdBefore);
    }

    public CoaRecordQuery withIds(Collection<String> values) {
        return new CoaRecordQuery(userId, batchId, values == null ? null : Set.copyOf(values), createdFrom, createdBefore);
    }

    public CoaRecordQuery createdBetween(Instant from, Instant before) {
        return new CoaRecordQuery(userId, batchId, ids, from, before);
    }

	/**
	 * Evaluates the filter against a stored record.
	 */
    public boolean matches(CoaRecord record) {
        if (!Objects.equals(userId, record.userId())) {
            return false;
        }
        if (batchId != null && !batchId.equals(record.batchId())) {
            return false;
        }
        if (ids != null && !ids.contains(record.id())) {
            return false;
        }
        if (createdFrom != null && record.createdAt().isBefore(createdFrom)) {
            return false;
        }
        return createdBefore == null || record.createdAt().isBefore(createdBefore);
    }
}
