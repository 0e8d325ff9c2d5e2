package se.bolan.ratedb.crawler.banks;

import static org.assertj.core.api.Assertions.*;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.bolan.ratedb.crawler.CrawlerTestSupport;
import se.bolan.ratedb.crawler.DummyFetcher;
import se.bolan.ratedb.extract.sheet.SheetFixtures;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.RateType;
import se.bolan.ratedb.model.Term;

class NordeaTest {
	private static final String XLSX_URL = "https://www.nordea.se/siteassets/bolan/historiska-bolanerantor.xlsx?v=2025";

	private static byte[] historicWorkbook() throws Exception {
		Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
		sheets.put("Diagram", List.of(List.of("Utveckling")));
		sheets.put("Ränteändringsdagar", List.of(
				List.of("Historiska bolåneräntor"),
				List.of("Ränteändringsdag", "3 mån", "1 år", "Kommentar"),
				Arrays.asList(LocalDate.of(2025, 10, 1), 3.84, 3.59),
				Arrays.asList("06-15-25", "3,64 %", null, "Sänkning"),
				List.of("Källa: Nordea")));
		return SheetFixtures.workbook(sheets);
	}

	private static DummyFetcher fetcher() throws Exception {
		return new DummyFetcher()
				.withPage(Nordea.LIST_URL, CrawlerTestSupport.fixture("nordea/listrantor.html"))
				.withPage(Nordea.HISTORIC_URL, CrawlerTestSupport.fixture("nordea/historiska-bolanerantor.html"))
				.withBytes(XLSX_URL, historicWorkbook());
	}

	@Test
	void testListRates() throws Exception {
		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new Nordea(CrawlerTestSupport.config(fetcher())));

		// Then
		assertThat(run.result().success()).isTrue();
		assertThat(run.records())
				.filteredOn(record -> record.type() == RateType.LIST_RATE)
				.extracting(InterestSet::term, InterestSet::nominalRate, InterestSet::changedOn)
				.containsExactly(
						tuple(Term.THREE_MONTHS, 3.84, LocalDate.of(2025, 10, 1)),
						tuple(Term.ONE_YEAR, 3.59, LocalDate.of(2025, 6, 15)));
	}

	@Test
	void testHistoricRatesFromWorkbook() throws Exception {
		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new Nordea(CrawlerTestSupport.config(fetcher())));

		// Then
		assertThat(run.records())
				.filteredOn(record -> record.type() == RateType.AVERAGE_RATE)
				.extracting(InterestSet::term, InterestSet::nominalRate, InterestSet::averageReferenceMonth)
				.containsExactly(
						tuple(Term.THREE_MONTHS, 3.84, new AvgMonth(2025, 10)),
						tuple(Term.ONE_YEAR, 3.59, new AvgMonth(2025, 10)),
						tuple(Term.THREE_MONTHS, 3.64, new AvgMonth(2025, 6)));
	}

	@Test
	void testMissingWorkbookLinkKeepsListRates() throws Exception {
		// Given
		var fetcher = new DummyFetcher()
				.withPage(Nordea.LIST_URL, CrawlerTestSupport.fixture("nordea/listrantor.html"))
				.withPage(Nordea.HISTORIC_URL, "<html><body><p>Sidan uppdateras</p></body></html>");

		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new Nordea(CrawlerTestSupport.config(fetcher)));

		// Then
		assertThat(run.result().success()).isTrue();
		assertThat(run.result().sectionsFailed()).isEqualTo(1);
		assertThat(run.records()).extracting(InterestSet::type).containsOnly(RateType.LIST_RATE);
	}

	@Test
	void testWorkbookWithoutTermColumnsFails() throws Exception {
		// Given
		Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
		sheets.put("Historik", List.of(List.of("Datum", "Kommentar"), List.of("10-01-25", "Oförändrad")));
		var fetcher = new DummyFetcher()
				.withPage(Nordea.HISTORIC_URL, CrawlerTestSupport.fixture("nordea/historiska-bolanerantor.html"))
				.withBytes(XLSX_URL, SheetFixtures.workbook(sheets));

		// When
		CrawlerTestSupport.Run run = CrawlerTestSupport.run(new Nordea(CrawlerTestSupport.config(fetcher)));

		// Then
		assertThat(run.result().success()).isFalse();
		assertThat(run.records()).isEmpty();
	}
}
