package com.example.coa.application.extraction;

import com.example.coa.application.service.IdentifierResolver;
import com.example.coa.domain.model.DocumentType;
import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ParsedDocument;
import com.example.coa.domain.model.SampleIdentifiers;
import com.example.coa.domain.schema.ColumnSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the extraction pipeline on a parsed document: lab detection, table values, text values and content
 * identifiers. Table values take precedence; text rules only fill the columns the tables left empty.
 */
@Component
public class CoaDocumentExtractor {

    private static final Logger log = LoggerFactory.getLogger(CoaDocumentExtractor.class);

    private final ColumnSchema schema;
    private final TableValueExtractor tableValueExtractor;
    private final TextParameterExtractor textParameterExtractor;
    private final IdentifierResolver identifierResolver;

    public CoaDocumentExtractor(ColumnSchema schema,
                                TableValueExtractor tableValueExtractor,
                                TextParameterExtractor textParameterExtractor,
                                IdentifierResolver identifierResolver) {
        this.schema = schema;
        this.tableValueExtractor = tableValueExtractor;
        this.textParameterExtractor = textParameterExtractor;
        this.identifierResolver = identifierResolver;
    }

	/**
	 * @param document      text and tables of one PDF
	 * @param targetColumns column names the run may emit
	 * @param phase         phase of the run
	 * @return extraction result with content identifiers only; file name fallback happens later
	 */
    public ExtractedRecord extract(ParsedDocument document, List<String> targetColumns, ExtractionPhase phase) {
        DocumentType documentType = DocumentType.detect(document.text());
        ParameterLabelMatcher matcher = ParameterLabelMatcher.forTargets(schema, targetColumns);

        TableExtraction tableValues = tableValueExtractor.extract(document.tables(), documentType, matcher);
        Map<String, String> fields = new LinkedHashMap<>(tableValues.fields());
        Map<String, String> textValues = textParameterExtractor.extract(document.text(), matcher.targets(), documentType);
        textValues.forEach((column, value) -> {
            String current = fields.get(column);
            if (current == null || current.isEmpty()) {
                fields.put(column, value);
            } else if (!current.equals(value)) {
                log.debug("Table value '{}' for {} overrides text value '{}' in {}", current, column, value,
                        document.fileName());
            }
        });

        SampleIdentifiers identifiers = identifierResolver.findInText(document.text());
        log.info("Extracted {} fields ({} from tables) and {} unmatched rows from {} [{}], sample={}, batch={}",
                fields.size(), tableValues.fields().size(), tableValues.unmatched().size(), document.fileName(),
                documentType, identifiers.sampleId(), identifiers.batchId());
        return new ExtractedRecord(identifiers.sampleId(), identifiers.batchId(), phase, documentType,
                fields, tableValues.unmatched());
    }
}
