package se.bolan.ratedb.crawler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.store.Store;
import se.bolan.ratedb.store.StoreException;

/**
 * Runs crawlers in parallel and stores what they produce. Every crawler gets its own thread, so a
 * crawler stuck on a slow site never delays the others. All crawlers share one {@link RateChannel}
 * that a single consumer thread drains into the {@link Store} while the crawlers are still running.
 * The channel is only closed once every crawler has finished or was cancelled.
 */
public class CrawlService {
	private static final Logger logger = LoggerFactory.getLogger(CrawlService.class);

	private final Store store;
	private final Duration timeout;

	/**
	 * Create a new CrawlService.
	 *
	 * @param store The store receiving all records
	 * @param timeout Time each crawler gets, counted from the moment it starts, before it is cancelled
	 */
	public CrawlService(Store store, Duration timeout) {
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("Timeout must be positive, was " + timeout);
		}
		this.store = store;
		this.timeout = timeout;
	}

	/** Run all crawlers to completion and report the outcome */
	public CrawlReport run(List<SiteCrawler> crawlers) throws InterruptedException {
		var channel = new RateChannel();
		var stored = new AtomicInteger(0);
		var storeFailures = new AtomicInteger(0);
		Thread consumer = new Thread(() -> consume(channel, stored, storeFailures), "rate-consumer");
		consumer.start();

		var results = new LinkedHashMap<String, CrawlResult>();
		ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, crawlers.size()));
		ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor();
		try {
			var tasks = new ArrayList<CrawlTask>();
			for (var crawler : crawlers) {
				var task = new CrawlTask(crawler, channel, watchdog);
				tasks.add(task);
				executor.execute(task.future);
			}

			for (var task : tasks) {
				results.put(task.crawler.name(), await(task));
			}
		} finally {
			watchdog.shutdownNow();
			executor.shutdownNow();
			// All crawlers are done or cancelled, late sends from cancelled ones are dropped
			channel.close();
			consumer.join();
		}

		if (channel.getDroppedCount() > 0) {
			logger.warn("Dropped {} records sent after the run ended", channel.getDroppedCount());
		}
		Map<String, Integer> summary = summarize();
		return new CrawlReport(results, summary, stored.get(), storeFailures.get());
	}

	private CrawlResult await(CrawlTask task) throws InterruptedException {
		String name = task.crawler.name();
		try {
			return task.future.get();
		} catch (CancellationException e) {
			if (!task.timedOut) {
				return CrawlResult.failure(e);
			}
			logger.error("Crawler {} timed out after {} ms and was cancelled", name, timeout.toMillis());
			return CrawlResult.failure(new TimeoutException("Timed out after " + timeout.toMillis() + " ms"));
		} catch (ExecutionException e) {
			logger.error("Crawler {} failed: {}", name, e.getCause().getMessage());
			return CrawlResult.failure(e.getCause() instanceof Exception ? (Exception) e.getCause() : e);
		}
	}

	/** One crawler run. The timeout is armed when the crawler starts and disarmed when it returns. */
	private class CrawlTask implements Callable<CrawlResult> {
		private final SiteCrawler crawler;
		private final RateChannel channel;
		private final ScheduledExecutorService watchdog;
		private final FutureTask<CrawlResult> future = new FutureTask<>(this);
		private volatile boolean timedOut;

		CrawlTask(SiteCrawler crawler, RateChannel channel, ScheduledExecutorService watchdog) {
			this.crawler = crawler;
			this.channel = channel;
			this.watchdog = watchdog;
		}

		@Override
		public CrawlResult call() {
			ScheduledFuture<?> alarm = watchdog.schedule(this::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
			try {
				return crawler.crawl(channel);
			} catch (RuntimeException e) {
				return CrawlResult.failure(e);
			} finally {
				alarm.cancel(false);
			}
		}

		private void expire() {
			timedOut = true;
			future.cancel(true);
		}
	}

	private void consume(RateChannel channel, AtomicInteger stored, AtomicInteger storeFailures) {
		try {
			InterestSet interestSet;
			while ((interestSet = channel.receive()) != null) {
				try {
					store.upsertInterestSet(interestSet);
					stored.incrementAndGet();
				} catch (StoreException | RuntimeException e) {
					storeFailures.incrementAndGet();
					logger.error("Failed to store {}: {}", interestSet, e.getMessage());
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Consumer interrupted, remaining records are lost");
		}
	}

	private Map<String, Integer> summarize() {
		Map<String, Integer> summary = new TreeMap<>();
		try {
			for (InterestSet interestSet : store.getInterestSets()) {
				summary.merge(interestSet.bank() + " " + interestSet.type(), 1, Integer::sum);
			}
		} catch (StoreException e) {
			logger.error("Failed to read stored records: {}", e.getMessage());
			return summary;
		}
		logger.info("Stored records per bank and type:");
		summary.forEach((key, count) -> logger.info("  {}: {}", key, count));
		return summary;
	}
}
