package se.bolan.ratedb.crawler;

import java.util.Map;

/**
 * Outcome of one run: the result of every crawler, keyed by crawler name, and the number of stored
 * records per bank and rate type.
 */
public record CrawlReport(
		Map<String, CrawlResult> results, Map<String, Integer> summary, int recordsStored, int storeFailures) {

	public long successfulCount() {
		return results.values().stream().filter(CrawlResult::success).count();
	}

	public long failedCount() {
		return results.size() - successfulCount();
	}

	/** True when crawlers ran and none of them succeeded */
	public boolean allFailed() {
		return !results.isEmpty() && successfulCount() == 0;
	}
}
