package se.bolan.ratedb.extract.pdf;

import static org.assertj.core.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.Term;

class PdfRateTableTest {

	@Test
	void testHeaderTerms() {
		// Given
		String text = "Genomsnittlig ränta 2025\nBindningstid 3 mån 1 år 2 år 3 mån 36 månader\n";

		// When
		List<Term> terms = PdfRateTable.headerTerms(text);

		// Then
		assertThat(terms).containsExactly(Term.THREE_MONTHS, Term.ONE_YEAR, Term.TWO_YEARS, Term.THREE_YEARS);
	}

	@Test
	void testDateAnchoredRows() {
		// Given
		String text = "Bindningstid 3 mån 1 år 2 år\n20251031 2,61 2,52 -\n20250930 2,90 2,80 2,70\n";

		// When
		List<PdfRateTable.PeriodRates> periods = PdfRateTable.parse(text, 3, PdfRateTable.Anchor.DATE_YYYYMMDD);

		// Then
		assertThat(periods).hasSize(2);
		assertThat(periods.get(0).month()).isEqualTo(new AvgMonth(2025, 10));
		assertThat(periods.get(0).rates()).isEqualTo(Arrays.asList(2.61, 2.52, null));
		assertThat(periods.get(1).month()).isEqualTo(new AvgMonth(2025, 9));
		assertThat(periods.get(1).rates()).containsExactly(2.90, 2.80, 2.70);
	}

	@Test
	void testMonthNameAnchorsOnOneLine() {
		// Given
		String text = "Bindningstid 3 mån 1 år oktober 2025 2,61% 2,52% september2025 2,90% 2,80%";

		// When
		List<PdfRateTable.PeriodRates> periods = PdfRateTable.parse(text, 2, PdfRateTable.Anchor.MONTH_NAME_YEAR);

		// Then
		assertThat(periods).extracting(PdfRateTable.PeriodRates::month)
				.containsExactly(new AvgMonth(2025, 10), new AvgMonth(2025, 9));
		assertThat(periods.get(0).rates()).containsExactly(2.61, 2.52);
		assertThat(periods.get(1).rates()).containsExactly(2.90, 2.80);
	}

	@Test
	void testInvalidAnchorsStayText() {
		// Given
		String text = "20251331 1,00 20251031 2,61";

		// When
		List<PdfRateTable.PeriodRates> periods = PdfRateTable.parse(text, 1, PdfRateTable.Anchor.DATE_YYYYMMDD);

		// Then
		assertThat(periods).hasSize(1);
		assertThat(periods.get(0).rates()).containsExactly(2.61);
	}
}
