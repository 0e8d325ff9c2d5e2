package se.bolan.ratedb.crawler.banks;

import static org.assertj.core.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import se.bolan.ratedb.crawler.CrawlerTestSupport;
import se.bolan.ratedb.crawler.DummyFetcher;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.RateType;
import se.bolan.ratedb.model.Term;

class DanskeBankTest {

	private static DummyFetcher fetcher() {
		return new DummyFetcher()
				.withPage(DanskeBank.URL, CrawlerTestSupport.fixture("danske-bank/aktuella-bolanerantor.html"));
	}

	@Test
	void testListRatesSkipPremiumRows() throws Exception {
		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new DanskeBank(CrawlerTestSupport.config(fetcher())));

		// Then
		assertThat(run.result().success()).isTrue();
		assertThat(run.records())
				.filteredOn(record -> record.type() == RateType.LIST_RATE)
				.extracting(InterestSet::term, InterestSet::nominalRate, InterestSet::changedOn)
				.containsExactly(
						tuple(Term.THREE_MONTHS, 3.99, LocalDate.of(2025, 10, 3)),
						tuple(Term.ONE_YEAR, 3.75, null));
	}

	@Test
	void testAverageRatesWithSplitRows() throws Exception {
		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new DanskeBank(CrawlerTestSupport.config(fetcher())));

		// Then
		assertThat(run.records())
				.filteredOn(record -> record.type() == RateType.AVERAGE_RATE)
				.extracting(InterestSet::term, InterestSet::nominalRate, InterestSet::averageReferenceMonth)
				.containsExactly(
						tuple(Term.THREE_MONTHS, 2.70, new AvgMonth(2025, 10)),
						tuple(Term.ONE_YEAR, 2.60, new AvgMonth(2025, 10)),
						tuple(Term.THREE_MONTHS, 2.80, new AvgMonth(2025, 9)),
						tuple(Term.ONE_YEAR, 2.65, new AvgMonth(2025, 9)),
						tuple(Term.THREE_YEARS, 2.90, new AvgMonth(2025, 9)));
		assertThat(run.result().rowsSkipped()).isZero();
	}

	@Test
	void testPageWithoutAverageTable() throws Exception {
		// Given
		var fetcher = new DummyFetcher().withPage(DanskeBank.URL, """
				<html><body>
				<h2>Bankens aktuella bolåneräntor</h2>
				<table><tr><th>Bindningstid</th><th>Ränta</th></tr><tr><td>3 mån</td><td>3,99 %</td></tr></table>
				</body></html>
				""");

		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new DanskeBank(CrawlerTestSupport.config(fetcher)));

		// Then
		assertThat(run.result().success()).isTrue();
		assertThat(run.result().sectionsFailed()).isEqualTo(1);
		assertThat(run.records()).singleElement().extracting(InterestSet::type).isEqualTo(RateType.LIST_RATE);
	}
}
