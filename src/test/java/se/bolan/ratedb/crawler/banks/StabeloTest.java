package se.bolan.ratedb.crawler.banks;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import se.bolan.ratedb.crawler.CrawlerTestSupport;
import se.bolan.ratedb.crawler.DummyFetcher;
import se.bolan.ratedb.extract.pdf.PdfFixtures;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.RateType;
import se.bolan.ratedb.model.Term;

class StabeloTest {
	private static final String PDF_URL = "https://www.stabelo.se/documents/stabelo-genomsnittsrantor-2025.pdf";

	private static DummyFetcher fetcher() throws Exception {
		return new DummyFetcher()
				.withPage(Stabelo.RATE_TABLE_URL, CrawlerTestSupport.fixture("stabelo/rate-table.html"))
				.withPage(Stabelo.AVERAGE_PAGE_URL, CrawlerTestSupport.fixture("stabelo/bolanerantor.html"))
				.withBytes(
						PDF_URL,
						PdfFixtures.lines(
								"Stabelo genomsnittsräntor",
								"Bindningstid 3 mån 1 år",
								"oktober 2025 2,61% 2,52%",
								"september 2025 2,90% 2,80%"));
	}

	@Test
	void testListRatesFromStreamData() throws Exception {
		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new Stabelo(CrawlerTestSupport.config(fetcher())));

		// Then
		assertThat(run.result().success()).isTrue();
		assertThat(run.records())
				.filteredOn(record -> record.type() == RateType.LIST_RATE)
				.extracting(InterestSet::term, InterestSet::nominalRate)
				.containsExactly(tuple(Term.THREE_MONTHS, 3.45), tuple(Term.ONE_YEAR, 2.99));
	}

	@Test
	void testButtonRatesCarryLoanToValueBracket() throws Exception {
		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new Stabelo(CrawlerTestSupport.config(fetcher())));

		// Then
		assertThat(run.records())
				.filteredOn(record -> record.type() == RateType.RATIO_DISCOUNTED_RATE)
				.extracting(InterestSet::term, InterestSet::nominalRate, InterestSet::ratioDiscountBoundaries)
				.containsExactly(
						tuple(Term.THREE_MONTHS, 3.45, Stabelo.BUTTON_BRACKET),
						tuple(Term.ONE_YEAR, 2.99, Stabelo.BUTTON_BRACKET));
	}

	@Test
	void testAverageRatesFromLinkedPdf() throws Exception {
		// Given
		DummyFetcher fetcher = fetcher();

		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new Stabelo(CrawlerTestSupport.config(fetcher)));

		// Then
		assertThat(run.records())
				.filteredOn(record -> record.type() == RateType.AVERAGE_RATE)
				.extracting(InterestSet::term, InterestSet::nominalRate, InterestSet::averageReferenceMonth)
				.containsExactly(
						tuple(Term.THREE_MONTHS, 2.61, new AvgMonth(2025, 10)),
						tuple(Term.ONE_YEAR, 2.52, new AvgMonth(2025, 10)),
						tuple(Term.THREE_MONTHS, 2.90, new AvgMonth(2025, 9)),
						tuple(Term.ONE_YEAR, 2.80, new AvgMonth(2025, 9)));
		assertThat(fetcher.getRequestedUrls()).contains(PDF_URL).doesNotContain("https://www.stabelo.se/documents/allmanna-villkor.pdf");
	}

	@Test
	void testMissingPdfLinkKeepsCurrentRates() throws Exception {
		// Given
		var fetcher = new DummyFetcher()
				.withPage(Stabelo.RATE_TABLE_URL, CrawlerTestSupport.fixture("stabelo/rate-table.html"))
				.withPage(Stabelo.AVERAGE_PAGE_URL, "<html><body><p>Inga dokument</p></body></html>");

		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new Stabelo(CrawlerTestSupport.config(fetcher)));

		// Then
		assertThat(run.result().success()).isTrue();
		assertThat(run.result().sectionsFailed()).isEqualTo(1);
		assertThat(run.records()).hasSize(4);
	}
}
