package se.bolan.ratedb.crawler;

/** Result of a crawler execution */
public record CrawlResult(
		boolean success, int recordsEmitted, int rowsSkipped, int sectionsFailed, Exception error) {

	public static CrawlResult success(int recordsEmitted, int rowsSkipped, int sectionsFailed) {
		return new CrawlResult(true, recordsEmitted, rowsSkipped, sectionsFailed, null);
	}

	public static CrawlResult failure(Exception error) {
		return new CrawlResult(false, 0, 0, 0, error);
	}

	public static CrawlResult failure(int recordsEmitted, int rowsSkipped, int sectionsFailed, Exception error) {
		return new CrawlResult(false, recordsEmitted, rowsSkipped, sectionsFailed, error);
	}

	@Override
	public String toString() {
		return success
				? "SUCCESS (%d records emitted, %d rows skipped, %d sections failed)"
						.formatted(recordsEmitted, rowsSkipped, sectionsFailed)
				: "FAILED - %s".formatted(error != null ? error.getMessage() : "Unknown error");
	}
}
