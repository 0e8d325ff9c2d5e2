package se.bolan.ratedb.extract.pdf;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import se.bolan.ratedb.extract.ExtractionException;

class PdfTextTest {

	@Test
	void testExtractsAllPages() throws Exception {
		// Given
		byte[] pdf = PdfFixtures.pages(new String[] {"Bindningstid 3 mån 1 år"}, new String[] {"20251031 2,61 2,52"});

		// When
		String text = PdfText.extract(pdf);

		// Then
		assertThat(text).contains("Bindningstid 3 mån 1 år");
		assertThat(text).contains("20251031 2,61 2,52");
		assertThat(text.indexOf("Bindningstid")).isLessThan(text.indexOf("20251031"));
	}

	@Test
	void testRejectsNonPdf() {
		assertThatThrownBy(() -> PdfText.extract("<html>".getBytes(StandardCharsets.UTF_8)))
				.isInstanceOf(ExtractionException.class);
	}
}
