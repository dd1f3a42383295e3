package com.example.coa.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Dashboard figures for one user's COA records.
 */
public record CoaStatistics(
        long totalSamplesThisMonth,
        long totalFiles,
        Instant lastUploadDate,
        List<MonthlyUploadCount> monthlyUploads
) {

	/**
	 * Number of records created within one calendar month.
	 *
	 * @param month   label such as "Mar 25"
	 * @param uploads record count
	 */
    public record MonthlyUploadCount(String month, long uploads) {
    }
}
