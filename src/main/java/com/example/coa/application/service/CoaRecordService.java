package com.example.coa.application.service;

import com.example.coa.application.exception.UseCaseValidationException;
import com.example.coa.domain.model.CoaRecord;
import com.example.coa.domain.model.CoaStatistics;
import com.example.coa.domain.repository.CoaRecordQuery;
import com.example.coa.domain.repository.CoaRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Read and delete operations on stored COA records, always scoped to one user.
 */
@Service
public class CoaRecordService {

    private static final Logger log = LoggerFactory.getLogger(CoaRecordService.class);
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yy", Locale.US);
    static final int STATISTICS_MONTHS = 6;

    private final CoaRecordStore store;
    private final Clock clock;

    public CoaRecordService(CoaRecordStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

	/**
	 * Lists the user's records, newest first. Users without records of their own see the unowned legacy records.
	 */
    public List<CoaRecord> listRecords(String userId) {
        List<CoaRecord> records = store.findMany(CoaRecordQuery.forUser(userId));
        if (records.isEmpty() && userId != null) {
            records = store.findMany(CoaRecordQuery.forUser(null));
            if (!records.isEmpty()) {
                log.debug("User {} has no records, returning {} unowned records", userId, records.size());
            }
        }
        List<CoaRecord> newestFirst = new ArrayList<>(records);
        newestFirst.sort(Comparator.comparing(CoaRecord::createdAt).reversed());
        return newestFirst;
    }

	/**
	 * Deletes the given records. Ids that belong to another user are ignored.
	 *
	 * @return number of deleted records
	 * @throws UseCaseValidationException when no id was supplied
	 */
    public int deleteRecords(String userId, List<String> recordIds) {
        if (recordIds == null || recordIds.isEmpty()) {
            throw new UseCaseValidationException("No record IDs provided");
        }
        int deleted = store.deleteMany(CoaRecordQuery.forUser(userId).withIds(recordIds));
        log.info("Deleted {} of {} requested COA records for user {}", deleted, recordIds.size(), userId);
        return deleted;
    }

    public CoaStatistics statistics(String userId) {
        ZoneId zone = clock.getZone();
        YearMonth currentMonth = YearMonth.now(clock);
        CoaRecordQuery userRecords = CoaRecordQuery.forUser(userId);

        long thisMonth = store.count(userRecords.createdBetween(startOf(currentMonth, zone), null));
        List<CoaRecord> all = store.findMany(userRecords);
        Instant lastUpload = all.stream().map(CoaRecord::createdAt).max(Comparator.naturalOrder()).orElse(null);

        List<CoaStatistics.MonthlyUploadCount> monthly = new ArrayList<>(STATISTICS_MONTHS);
        for (int offset = STATISTICS_MONTHS - 1; offset >= 0; offset--) {
            YearMonth month = currentMonth.minusMonths(offset);
            long uploads = store.count(userRecords.createdBetween(startOf(month, zone), startOf(month.plusMonths(1), zone)));
            monthly.add(new CoaStatistics.MonthlyUploadCount(month.format(MONTH_LABEL), uploads));
        }
        return new CoaStatistics(thisMonth, all.size(), lastUpload, monthly);
    }

    private static Instant startOf(YearMonth month, ZoneId zone) {
        return month.atDay(1).atStartOfDay(zone).toInstant();
    }
}
