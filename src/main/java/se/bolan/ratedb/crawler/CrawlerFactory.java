package se.bolan.ratedb.crawler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;
import org.slf4j.LoggerFactory;

/** Factory for creating crawler instances using ServiceLoader */
public class CrawlerFactory {
	private final Fetcher fetcher;
	private final Instant crawlTime;

	public static CrawlerFactory create(Fetcher fetcher, Instant crawlTime) {
		return new CrawlerFactory(fetcher, crawlTime);
	}

	private CrawlerFactory(Fetcher fetcher, Instant crawlTime) {
		this.fetcher = fetcher;
		this.crawlTime = crawlTime;
	}

	/** Create all available crawlers, ordered by name */
	public List<SiteCrawler> createAllCrawlers() {
		List<SiteCrawler> crawlers = new ArrayList<>();
		for (SiteCrawler.Discovery discovery : getAvailableCrawlerDiscoveries().values()) {
			crawlers.add(discovery.create(configFor(discovery.name())));
		}
		return crawlers;
	}

	/** Create specific crawler by name */
	public SiteCrawler createCrawler(String crawlerName) {
		SiteCrawler.Discovery discovery = getAvailableCrawlerDiscoveries().get(crawlerName);
		if (discovery == null) {
			throw new IllegalArgumentException("Unknown crawler ID: " + crawlerName);
		}
		return discovery.create(configFor(crawlerName));
	}

	private CrawlerConfig configFor(String crawlerName) {
		return new CrawlerConfig(fetcher, LoggerFactory.getLogger(crawlerName), crawlTime);
	}

	/** Get all available crawler discoveries, keyed and sorted by name */
	public static Map<String, SiteCrawler.Discovery> getAvailableCrawlerDiscoveries() {
		Map<String, SiteCrawler.Discovery> discs = new TreeMap<>();

		ServiceLoader<SiteCrawler.Discovery> loader = ServiceLoader.load(SiteCrawler.Discovery.class);
		for (SiteCrawler.Discovery discovery : loader) {
			discs.put(discovery.name(), discovery);
		}

		return discs;
	}
}
