package se.bolan.ratedb.crawler;

import java.time.Instant;
import org.slf4j.Logger;

/**
 * Configuration record for crawler instances. Holds the fetcher used for all requests, the logger
 * named after the crawler and the time stamp given to every record of the run.
 */
public record CrawlerConfig(Fetcher fetcher, Logger logger, Instant crawlTime) {}
