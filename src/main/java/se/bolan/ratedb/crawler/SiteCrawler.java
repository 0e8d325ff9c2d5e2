package se.bolan.ratedb.crawler;

/**
 * A crawler for one institution. Crawlers write normalized records to the channel they are given
 * and never close it. Errors are handled inside the crawler and reported through the result.
 */
public interface SiteCrawler {

	/** Stable crawler id, as used on the command line */
	String name();

	/** Crawl all sources of the institution, sending every record to {@code out} */
	CrawlResult crawl(RateChannel out);

	/** Factory interface for crawler discovery */
	interface Discovery {
		String name();

		String bank();

		SiteCrawler create(CrawlerConfig config);
	}
}
