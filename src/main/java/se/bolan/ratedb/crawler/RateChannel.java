package se.bolan.ratedb.crawler;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.bolan.ratedb.model.InterestSet;

/**
 * Unbounded channel between the crawlers and the single consumer. Any number of threads may send,
 * one thread receives. Once closed, sends are dropped and the receiver gets the remaining records
 * before {@link #receive()} returns null.
 */
public class RateChannel {
	private static final Logger logger = LoggerFactory.getLogger(RateChannel.class);
	private static final long POLL_MILLIS = 500;

	private final BlockingQueue<InterestSet> queue = new LinkedBlockingQueue<>();
	private final AtomicInteger sentCount = new AtomicInteger(0);
	private final AtomicInteger droppedCount = new AtomicInteger(0);
	private volatile boolean closed;

	/**
	 * Send a record to the consumer.
	 *
	 * @return false if the channel was already closed and the record was dropped
	 */
	public synchronized boolean send(InterestSet interestSet) {
		if (closed) {
			droppedCount.incrementAndGet();
			logger.warn("Dropping record sent after close: {}", interestSet);
			return false;
		}
		queue.add(interestSet);
		sentCount.incrementAndGet();
		return true;
	}

	/** Close the channel. Records already sent are still delivered. */
	public synchronized void close() {
		closed = true;
	}

	public boolean isClosed() {
		return closed;
	}

	/**
	 * Wait for the next record.
	 *
	 * @return the next record, or null once the channel is closed and empty
	 */
	public InterestSet receive() throws InterruptedException {
		while (true) {
			InterestSet next = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
			if (next != null) {
				return next;
			}
			// Every send happens before close, so an empty queue after close stays empty
			if (closed && queue.isEmpty()) {
				return null;
			}
		}
	}

	public int getSentCount() {
		return sentCount.get();
	}

	public int getDroppedCount() {
		return droppedCount.get();
	}
}
