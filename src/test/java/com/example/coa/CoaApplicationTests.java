package com.example.coa;

import com.example.coa.application.extraction.ExtractionBackend;
import com.example.coa.infrastructure.pdf.PdfBoxExtractionBackend;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke tests for verifying the Spring context boots with the documented beans.
 */
@SpringBootTest
class CoaApplicationTests {

	@Autowired
	private ExtractionBackend extractionBackend;

	/**
	 * Ensures the context loads and the in-process PDFBox backend is the default.
	 */
	@Test
	void contextLoads() {
		assertThat(extractionBackend).isInstanceOf(PdfBoxExtractionBackend.class);
	}

}
