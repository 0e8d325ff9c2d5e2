package se.bolan.ratedb.crawler;

import static org.assertj.core.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CrawlResultTest {

	@Test
	void testSuccessResult() {
		// When
		CrawlResult result = CrawlResult.success(10, 2, 1);

		// Then
		assertThat(result.success()).isTrue();
		assertThat(result.recordsEmitted()).isEqualTo(10);
		assertThat(result.rowsSkipped()).isEqualTo(2);
		assertThat(result.sectionsFailed()).isEqualTo(1);
		assertThat(result.error()).isNull();
		assertThat(result.toString()).isEqualTo("SUCCESS (10 records emitted, 2 rows skipped, 1 sections failed)");
	}

	@Test
	void testFailureResult() {
		// Given
		Exception exception = new RuntimeException("Test error");

		// When
		CrawlResult result = CrawlResult.failure(exception);

		// Then
		assertThat(result.success()).isFalse();
		assertThat(result.recordsEmitted()).isZero();
		assertThat(result.error()).isSameAs(exception);
		assertThat(result.toString()).isEqualTo("FAILED - Test error");
	}

	@Test
	void testReportCounts() {
		// Given
		Map<String, CrawlResult> results = new LinkedHashMap<>();
		results.put("a", CrawlResult.success(1, 0, 0));
		results.put("b", CrawlResult.failure(new RuntimeException("boom")));

		// When
		var report = new CrawlReport(results, Map.of(), 1, 0);
		var allFailed = new CrawlReport(Map.of("b", CrawlResult.failure(new RuntimeException("boom"))), Map.of(), 0, 0);

		// Then
		assertThat(report.successfulCount()).isEqualTo(1);
		assertThat(report.failedCount()).isEqualTo(1);
		assertThat(report.allFailed()).isFalse();
		assertThat(allFailed.allFailed()).isTrue();
		assertThat(new CrawlReport(Map.of(), Map.of(), 0, 0).allFailed()).isFalse();
	}
}
