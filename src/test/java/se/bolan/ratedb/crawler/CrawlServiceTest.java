package se.bolan.ratedb.crawler;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.RateType;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.store.MemoryStore;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TermParser;

class CrawlServiceTest {

	/** Crawler that never finishes on its own */
	private static class SleepingCrawler implements SiteCrawler {
		@Override
		public String name() {
			return "sleeping";
		}

		@Override
		public CrawlResult crawl(RateChannel out) {
			try {
				Thread.sleep(30_000);
				return CrawlResult.success(0, 0, 0);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return CrawlResult.failure(e);
			}
		}
	}

	/** Crawler that only succeeds once all crawlers sharing the latch have started */
	private static class WaitingCrawler implements SiteCrawler {
		private final String name;
		private final CountDownLatch started;

		WaitingCrawler(String name, CountDownLatch started) {
			this.name = name;
			this.started = started;
		}

		@Override
		public String name() {
			return name;
		}

		@Override
		public CrawlResult crawl(RateChannel out) {
			started.countDown();
			try {
				if (!started.await(5, TimeUnit.SECONDS)) {
					return CrawlResult.failure(new IllegalStateException("Not all crawlers were started"));
				}
				return CrawlResult.success(0, 0, 0);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return CrawlResult.failure(e);
			}
		}
	}

	/** Crawler reading a single "Aktuella räntor:" table */
	private static class TableCrawler extends BaseCrawler {
		static final String URL = "https://bank.example/rates";

		TableCrawler(CrawlerConfig config) {
			super(config);
		}

		@Override
		public String name() {
			return "table";
		}

		@Override
		protected String bank() {
			return "Table Bank";
		}

		@Override
		protected void scrape() throws Exception {
			section("list rates", () -> {
				HtmlTable table = TableLocator.byTextBefore(fetch(URL), "Aktuella räntor:");
				for (List<String> row : table.rows()) {
					emitListRate(TermParser.parse(row.get(0)), RateParser.parse(row.get(1)));
				}
			});
		}
	}

	private static Map<Term, Double> rates(double threeMonths, double oneYear) {
		Map<Term, Double> rates = new LinkedHashMap<>();
		rates.put(Term.THREE_MONTHS, threeMonths);
		rates.put(Term.ONE_YEAR, oneYear);
		return rates;
	}

	@Test
	void testFailingCrawlerDoesNotAffectOthers() throws Exception {
		// Given
		var store = new MemoryStore();
		var service = new CrawlService(store, Duration.ofSeconds(10));
		CrawlerConfig config = CrawlerTestSupport.config(new DummyFetcher());
		List<SiteCrawler> crawlers = List.of(
				new DummyCrawler(config, "broken", rates(3.0, 3.1), true, "Layout changed"),
				new DummyCrawler(config, "working", rates(3.33, 3.44)));

		// When
		CrawlReport report = service.run(crawlers);

		// Then
		assertThat(report.results().get("broken").success()).isFalse();
		assertThat(report.results().get("broken").error()).hasMessage("Layout changed");
		assertThat(report.results().get("working").success()).isTrue();
		assertThat(report.successfulCount()).isEqualTo(1);
		assertThat(report.failedCount()).isEqualTo(1);
		assertThat(report.recordsStored()).isEqualTo(2);
		assertThat(store.getInterestSets())
				.extracting(InterestSet::bank)
				.containsOnly("Dummy Bank working");
		assertThat(report.summary()).containsExactly(entry("Dummy Bank working listRate", 2));
	}

	@Test
	void testTimedOutCrawlerIsCancelled() throws Exception {
		// Given
		var store = new MemoryStore();
		var service = new CrawlService(store, Duration.ofMillis(300));
		CrawlerConfig config = CrawlerTestSupport.config(new DummyFetcher());
		List<SiteCrawler> crawlers = List.of(new SleepingCrawler(), new DummyCrawler(config, "quick", rates(3.1, 3.2)));

		// When
		long start = System.nanoTime();
		CrawlReport report = service.run(crawlers);
		Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

		// Then
		assertThat(elapsed).isLessThan(Duration.ofSeconds(10));
		assertThat(report.results().get("sleeping").success()).isFalse();
		assertThat(report.results().get("sleeping").error()).isInstanceOf(TimeoutException.class);
		assertThat(report.results().get("quick").success()).isTrue();
		assertThat(store.getInterestSets()).hasSize(2);
	}

	@Test
	void testEmptyCrawlerList() throws Exception {
		// Given
		var service = new CrawlService(new MemoryStore(), Duration.ofSeconds(1));

		// When
		CrawlReport report = service.run(List.of());

		// Then
		assertThat(report.results()).isEmpty();
		assertThat(report.allFailed()).isFalse();
		assertThat(report.recordsStored()).isZero();
	}

	@Test
	void testInvalidTimeout() {
		assertThatThrownBy(() -> new CrawlService(new MemoryStore(), Duration.ZERO))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testHungCrawlerDoesNotDelaySiblings() throws Exception {
		// Given
		var store = new MemoryStore();
		var service = new CrawlService(store, Duration.ofMillis(500));
		CrawlerConfig config = CrawlerTestSupport.config(new DummyFetcher());
		Map<Term, Double> rates = new LinkedHashMap<>();
		rates.put(Term.THREE_MONTHS, 3.33);
		List<SiteCrawler> crawlers = List.of(new SleepingCrawler(), new DummyCrawler(config, "ok", rates));

		// When
		CrawlReport report = service.run(crawlers);

		// Then
		assertThat(report.results().get("sleeping").success()).isFalse();
		assertThat(report.results().get("sleeping").error())
				.isInstanceOf(TimeoutException.class)
				.hasMessage("Timed out after 500 ms");
		assertThat(report.results().get("ok").success()).isTrue();
		assertThat(store.getInterestSets())
				.extracting(InterestSet::term, InterestSet::nominalRate)
				.containsExactly(tuple(Term.THREE_MONTHS, 3.33));
	}

	@Test
	void testAllCrawlersRunAtTheSameTime() throws Exception {
		// Given
		int count = Runtime.getRuntime().availableProcessors() * 2 + 4;
		var started = new CountDownLatch(count);
		List<SiteCrawler> crawlers = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			crawlers.add(new WaitingCrawler("waiting-" + i, started));
		}
		var service = new CrawlService(new MemoryStore(), Duration.ofSeconds(10));

		// When
		CrawlReport report = service.run(crawlers);

		// Then
		assertThat(report.successfulCount()).isEqualTo(count);
		assertThat(report.failedCount()).isZero();
	}

	@Test
	void testCrawlFromHtmlToStore() throws Exception {
		// Given
		String html = """
				<html><body>
				<h2>Aktuella räntor:</h2>
				<table>
				<tr><th>Bindningstid</th><th>Ränta</th></tr>
				<tr><td>3 mån</td><td>3,33 %</td></tr>
				<tr><td>1 år</td><td>3,44 %</td></tr>
				</table>
				</body></html>
				""";
		var fetcher = new DummyFetcher().withPage(TableCrawler.URL, html);
		var store = new MemoryStore();
		var service = new CrawlService(store, Duration.ofSeconds(10));

		// When
		CrawlReport report = service.run(List.of(new TableCrawler(CrawlerTestSupport.config(fetcher))));

		// Then
		assertThat(report.results().get("table").success()).isTrue();
		assertThat(store.getInterestSets())
				.extracting(InterestSet::bank, InterestSet::type, InterestSet::term, InterestSet::nominalRate)
				.containsExactlyInAnyOrder(
						tuple("Table Bank", RateType.LIST_RATE, Term.THREE_MONTHS, 3.33),
						tuple("Table Bank", RateType.LIST_RATE, Term.ONE_YEAR, 3.44));
		assertThat(fetcher.getRequestedUrls()).containsExactly(TableCrawler.URL);
	}
}
