package com.example.coa.application.extraction;

import com.example.coa.domain.model.ExtractedRecord;
import com.example.coa.domain.model.ExtractionPhase;

import java.nio.file.Path;
import java.util.List;

/**
 * Replaceable PDF front-end: one document in, one extraction result out.
 * Implementations throw an unchecked exception when the document cannot be processed; callers treat it as a
 * failure of that document only.
 */
public interface ExtractionBackend {

	/**
	 * @param pdf              document on local disk
	 * @param originalFileName name the document was uploaded under
	 * @param targetColumns    ordered column names the run may emit; blanks and duplicates are allowed
	 * @param phase            extraction phase of the run
	 * @return extraction result, identifiers taken from the document content only
	 */
    ExtractedRecord extract(Path pdf, String originalFileName, List<String> targetColumns, ExtractionPhase phase);
}
