package com.example.coa.application.service;

import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.SampleIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and normalizes the sample and batch identifiers that key a COA record.
 * <p>
 * Sample ids look like {@code M20243602}; labs print them with or without the {@code M} prefix and with stray
 * whitespace, so comparisons always go through {@link #normalizeSampleId(String)}. Batch ids look like
 * {@code BA001734} and are only trimmed.
 * <p>
 * The leading {@code M} is stripped only when a digit or the end of the id follows it. A blanket
 * "strip any leading M" rule would turn {@code "MX1"} into {@code "X1"} and {@code "M-2024"} into {@code "-2024"},
 * and would strip again on a second pass ({@code "MM1"}); ids like these are compared as printed instead.
 */
@Service
public class IdentifierResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentifierResolver.class);

    private static final Pattern SAMPLE_ID = Pattern.compile("\\bM\\s*\\d{8}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BATCH_ID = Pattern.compile("\\bBA\\d{6}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SAMPLE_DESCRIPTION_LINE =
            Pattern.compile("Sample\\s+description:\\s*([^\\n\\r]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SAMPLE_NUMBER_LINE =
            Pattern.compile("Sample\\s+No:\\s*([^\\n\\r]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SAMPLE_PREFIX = Pattern.compile("^[Mm]\\s*(?=\\d|$)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	/**
	 * Canonical sample id used for equality only: trimmed, one leading {@code M} (any case) and the whitespace
	 * after it removed. Idempotent.
	 *
	 * @param rawSampleId stored or extracted sample id
	 * @return normalized id, {@code null} when nothing is left
	 */
    public String normalizeSampleId(String rawSampleId) {
        if (rawSampleId == null) {
            return null;
        }
        String stripped = SAMPLE_PREFIX.matcher(rawSampleId.trim()).replaceFirst("").trim();
        return stripped.isEmpty() ? null : stripped;
    }

	/**
	 * @return trimmed batch id, {@code null} when blank
	 */
    public String normalizeBatchId(String rawBatchId) {
        if (rawBatchId == null) {
            return null;
        }
        String trimmed = rawBatchId.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

	/**
	 * Reads identifiers from an upload name such as {@code "BA001734 - M20253004 - Nofalab.pdf"}.
	 * Both patterns are searched independently; whitespace inside the sample id is removed.
	 */
    public SampleIdentifiers extractFromFilename(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return SampleIdentifiers.empty();
        }
        return new SampleIdentifiers(findSampleId(fileName), findBatchId(fileName));
    }

	/**
	 * Reads identifiers from the document text. The sample id is looked up in the "Sample description:" line,
	 * then in the "Sample No:" line, then anywhere in the text.
	 */
    public SampleIdentifiers findInText(String text) {
        if (text == null || text.isBlank()) {
            return SampleIdentifiers.empty();
        }
        String sampleId = findSampleIdInLine(SAMPLE_DESCRIPTION_LINE, text);
        if (sampleId == null) {
            sampleId = findSampleIdInLine(SAMPLE_NUMBER_LINE, text);
        }
        if (sampleId == null) {
            sampleId = findSampleId(text);
        }
        return new SampleIdentifiers(sampleId, findBatchId(text));
    }

	/**
	 * Fills missing identifiers of an extraction from its file name. Identifiers found in the content are kept.
	 *
	 * @param extraction extraction result of one document
	 * @param fileName   original upload name
	 * @return the same instance when nothing was missing or nothing could be filled, otherwise a copy
	 */
    public ExtractedRecord resolve(ExtractedRecord extraction, String fileName) {
        boolean sampleMissing = isBlank(extraction.sampleId());
        boolean batchMissing = isBlank(extraction.batchId());
        if (!sampleMissing && !batchMissing) {
            return extraction;
        }
        SampleIdentifiers fromName = extractFromFilename(fileName);
        log.info("Identifiers missing in content of {} (sample={}, batch={}); file name yields sample={}, batch={}",
                fileName, extraction.sampleId(), extraction.batchId(), fromName.sampleId(), fromName.batchId());
        String sampleId = sampleMissing && fromName.sampleId() != null ? fromName.sampleId() : extraction.sampleId();
        String batchId = batchMissing && fromName.batchId() != null ? fromName.batchId() : extraction.batchId();
        if (Objects.equals(sampleId, extraction.sampleId()) && Objects.equals(batchId, extraction.batchId())) {
            return extraction;
        }
        return extraction.withIdentifiers(sampleId, batchId);
    }

    private static String findSampleIdInLine(Pattern linePattern, String text) {
        Matcher line = linePattern.matcher(text);
        return line.find() ? findSampleId(line.group(1)) : null;
    }

    private static String findSampleId(String text) {
        Matcher matcher = SAMPLE_ID.matcher(text);
        return matcher.find() ? WHITESPACE.matcher(matcher.group()).replaceAll("") : null;
    }

    private static String findBatchId(String text) {
        Matcher matcher = BATCH_ID.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
