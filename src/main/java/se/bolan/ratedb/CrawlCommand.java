package se.bolan.ratedb;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import se.bolan.ratedb.crawler.CrawlReport;
import se.bolan.ratedb.crawler.CrawlService;
import se.bolan.ratedb.crawler.CrawlerFactory;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.store.JsonFileStore;
import se.bolan.ratedb.store.MemoryStore;
import se.bolan.ratedb.store.Store;
import se.bolan.ratedb.util.HttpFetcher;

/** Crawl the configured banks and store their mortgage rates */
@Command(
		name = "crawl",
		description = "Crawl bank websites for list and average mortgage rates",
		mixinStandardHelpOptions = true)
public class CrawlCommand implements Callable<Integer> {

	@Option(
			names = {"-c", "--crawlers"},
			description = "Comma-separated list of crawler IDs to run (if not specified, all crawlers run)",
			split = ",")
	private List<String> crawlerIds;

	@Option(
			names = {"-l", "--list"},
			description = "List all available crawler IDs and exit")
	private boolean listCrawlers;

	@Option(
			names = {"--timeout"},
			description = "Seconds each crawler may run before it is cancelled (default: 120)",
			defaultValue = "120")
	private int timeoutSeconds;

	@Option(
			names = {"--fetch-timeout"},
			description = "Seconds a single HTTP request may take (default: 30)",
			defaultValue = "30")
	private int fetchTimeoutSeconds;

	@Option(
			names = {"--retries"},
			description = "How often a failed HTTP request is repeated (default: 0)",
			defaultValue = "0")
	private int retries;

	@Option(
			names = {"-o", "--output"},
			description = "JSON file to merge the results into (if not specified, results are only kept in memory)")
	private Path output;

	@Override
	public Integer call() throws Exception {
		if (listCrawlers) {
			listAvailableCrawlers();
			return 0;
		}

		System.out.println("Bolan Rate Crawler");
		System.out.println("==================");
		System.out.println("Output: " + (output != null ? output.toAbsolutePath() : "memory only"));
		System.out.println("Crawler timeout: " + timeoutSeconds + " seconds");
		System.out.println();

		var fetcher = new HttpFetcher(Duration.ofSeconds(fetchTimeoutSeconds), retries);
		var fact = CrawlerFactory.create(fetcher, Instant.now());
		var allDiscoveries = CrawlerFactory.getAvailableCrawlerDiscoveries();
		if (crawlerIds == null) {
			crawlerIds = new ArrayList<>(allDiscoveries.keySet());
		}
		var crawlers = new ArrayList<SiteCrawler>();
		for (var crawlerId : crawlerIds) {
			if (!allDiscoveries.containsKey(crawlerId)) {
				System.err.println("Warning: Unknown crawler ID: " + crawlerId);
				continue;
			}
			crawlers.add(fact.createCrawler(crawlerId));
		}
		if (crawlers.isEmpty()) {
			System.out.println("No crawlers to run.");
			return 0;
		}

		System.out.println("Running crawlers: "
				+ String.join(", ", crawlers.stream().map(SiteCrawler::name).toList()));
		System.out.println();

		JsonFileStore fileStore = output != null ? JsonFileStore.open(output) : null;
		Store store = fileStore != null ? fileStore : new MemoryStore();

		long startTime = System.currentTimeMillis();
		var service = new CrawlService(store, Duration.ofSeconds(timeoutSeconds));
		CrawlReport report = service.run(crawlers);
		var duration = (System.currentTimeMillis() - startTime) / 1000.0;

		if (fileStore != null) {
			fileStore.flush();
		}

		printSummary(report);
		System.out.println();
		System.out.println("All crawlers completed in " + duration + " seconds");

		return report.allFailed() ? 1 : 0;
	}

	private void printSummary(CrawlReport report) {
		System.out.println();
		System.out.println("Execution Summary");
		System.out.println("=================");
		for (var entry : report.results().entrySet()) {
			System.out.printf("  %s: %s%n", entry.getKey(), entry.getValue());
		}

		System.out.println();
		System.out.println("Stored Records");
		System.out.println("==============");
		report.summary().forEach((key, count) -> System.out.printf("  %s: %d%n", key, count));

		System.out.println();
		System.out.println("Total crawlers: " + report.results().size());
		System.out.println("Successful: " + report.successfulCount());
		System.out.println("Failed: " + report.failedCount());
		System.out.println("Records stored: " + report.recordsStored());
		System.out.println("Store failures: " + report.storeFailures());
	}

	private void listAvailableCrawlers() {
		System.out.println("Available Crawlers:");
		System.out.println("===================");

		var discoveries = CrawlerFactory.getAvailableCrawlerDiscoveries();
		for (var discovery : discoveries.values()) {
			System.out.println("  - " + discovery.name() + " (" + discovery.bank() + ")");
		}

		System.out.println();
		System.out.println("Total: " + discoveries.size() + " crawlers");
	}
}
