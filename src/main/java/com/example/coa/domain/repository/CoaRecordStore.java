package com.example.coa.domain.repository;

import com.example.coa.domain.model.CoaRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for COA records. Implementations own id generation and timestamps.
 */
public interface CoaRecordStore {

	/**
	 * Stores a new record. The id, {@code createdAt} and {@code updatedAt} of the draft are ignored.
	 *
	 * @param draft record content
	 * @return stored record with its assigned id and timestamps
	 */
    CoaRecord create(CoaRecord draft);

    Optional<CoaRecord> findById(String id);

	/**
	 * @return matching records ordered by creation time, oldest first
	 */
    List<CoaRecord> findMany(CoaRecordQuery query);

	/**
	 * Applies a patch and bumps {@code updatedAt}.
	 *
	 * @throws java.util.NoSuchElementException when no record has the given id
	 */
    CoaRecord update(String id, CoaRecordPatch patch);

    boolean delete(String id);

    int deleteMany(CoaRecordQuery query);

    long count(CoaRecordQuery query);
}
