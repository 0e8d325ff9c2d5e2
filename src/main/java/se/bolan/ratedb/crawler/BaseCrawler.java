package se.bolan.ratedb.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import se.bolan.ratedb.extract.ExtractionException;
import se.bolan.ratedb.extract.pdf.PdfRateTable;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TermHeaderException;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.TextUtils;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Base class for all bank crawlers. A crawler is split into sections, one per source document, so
 * that a failing source only loses its own records.
 */
public abstract class BaseCrawler implements SiteCrawler {
	private static final ObjectMapper objectMapper = new ObjectMapper();

	protected final Fetcher fetcher;
	protected final Logger logger;
	protected final Instant crawlTime;

	private RateChannel out;
	private int emittedCount = 0;
	private int skippedCount = 0;
	private int sectionCount = 0;
	private int failedSectionCount = 0;

	public BaseCrawler(CrawlerConfig config) {
		this.fetcher = config.fetcher();
		this.logger = config.logger();
		this.crawlTime = config.crawlTime();
	}

	/** Institution name put on every record */
	protected abstract String bank();

	/** Execute the crawling logic, usually as a number of {@link #section} calls */
	protected abstract void scrape() throws Exception;

	/** One source document of a crawler */
	@FunctionalInterface
	protected interface Section {
		void run() throws Exception;
	}

	@Override
	public CrawlResult crawl(RateChannel out) {
		this.out = out;
		emittedCount = 0;
		skippedCount = 0;
		sectionCount = 0;
		failedSectionCount = 0;
		try {
			log("Starting crawler");

			scrape();

			if (sectionCount > 0 && failedSectionCount == sectionCount) {
				warn("All " + sectionCount + " sections failed");
				return CrawlResult.failure(
						emittedCount,
						skippedCount,
						failedSectionCount,
						new ExtractionException("All sections of " + name() + " failed"));
			}

			log("Completed successfully. Emitted " + emittedCount + " records, skipped " + skippedCount
					+ " rows, and had " + failedSectionCount + " failed sections.");
			return CrawlResult.success(emittedCount, skippedCount, failedSectionCount);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			warn("Interrupted after emitting " + emittedCount + " records");
			return CrawlResult.failure(emittedCount, skippedCount, failedSectionCount, e);
		} catch (Exception e) {
			warn("Failed with error: " + e.getMessage() + " (emitted " + emittedCount + " records)");
			return CrawlResult.failure(emittedCount, skippedCount, failedSectionCount, e);
		}
	}

	/**
	 * Run one section. Fetch and shape failures are logged and counted, after which the crawler
	 * continues with its next section. Interruption is passed on.
	 */
	protected void section(String name, Section section) throws InterruptedException {
		sectionCount++;
		try {
			fine("Running section " + name);
			section.run();
		} catch (InterruptedException e) {
			throw e;
		} catch (Exception e) {
			fail("Section " + name + " failed", e);
		}
	}

	/** Log a informative message */
	protected void log(String message) {
		logger.info(message);
	}

	/** Log a informative message */
	protected void fine(String message) {
		logger.trace(message);
	}

	/** Log a warning message */
	protected void warn(String message) {
		logger.warn(message);
	}

	/** Log failure of a whole section */
	protected void fail(String message, Exception error) {
		logger.error(message + ": " + error.getMessage());
		failedSectionCount++;
	}

	/** Log a row or field that could not be normalized. Header rows are only logged at debug level. */
	protected void skip(String what, ValueParseException error) {
		if (error instanceof TermHeaderException) {
			logger.debug("Skipping header " + what + ": " + error.getMessage());
		} else {
			logger.warn("Skipping " + what + ": " + error.getMessage());
		}
		skippedCount++;
	}

	/** Build the record and send it to the consumer. Invalid records are logged and skipped. */
	protected void emit(InterestSet.Builder builder) {
		InterestSet interestSet;
		try {
			interestSet = builder.bank(bank()).lastCrawledAt(crawlTime).build();
		} catch (IllegalStateException e) {
			logger.warn("Skipping invalid record: " + e.getMessage());
			skippedCount++;
			return;
		}
		if (out.send(interestSet)) {
			emittedCount++;
		}
	}

	protected void emitListRate(Term term, double rate) {
		emit(InterestSet.listRate(bank(), term, rate));
	}

	protected void emitAverageRate(Term term, double rate, AvgMonth month) {
		emit(InterestSet.averageRate(bank(), term, rate, month));
	}

	/** Parser for the month label that starts an average rate row */
	@FunctionalInterface
	protected interface MonthParser {
		AvgMonth parse(String label) throws ValueParseException;
	}

	/**
	 * Map header columns from {@code firstColumn} on to terms. Columns that are not terms, such as
	 * bank loan columns, are left out.
	 *
	 * @throws ExtractionException if no column is a term
	 */
	protected Map<Integer, Term> termColumns(List<String> header, int firstColumn) throws ExtractionException {
		Map<Integer, Term> columns = new LinkedHashMap<>();
		for (int i = firstColumn; i < header.size(); i++) {
			try {
				columns.put(i, TermParser.parse(header.get(i)));
			} catch (ValueParseException e) {
				logger.debug("Skipping header column '" + header.get(i) + "': " + e.getMessage());
			}
		}
		if (columns.isEmpty()) {
			throw new ExtractionException("No term columns found in header " + header);
		}
		return columns;
	}

	/**
	 * Emit the average rates of a table whose first column is the month. Empty and placeholder cells
	 * mean the bank has no rate for that month and are passed over silently.
	 */
	protected void emitAverageRows(List<List<String>> rows, Map<Integer, Term> columns, MonthParser monthParser) {
		for (List<String> row : rows) {
			if (row.size() < 2) {
				continue;
			}
			AvgMonth month;
			try {
				month = monthParser.parse(row.get(0));
			} catch (ValueParseException e) {
				skip("average month '" + row.get(0) + "'", e);
				continue;
			}
			for (var column : columns.entrySet()) {
				if (column.getKey() >= row.size() || TextUtils.isPlaceholder(row.get(column.getKey()))) {
					continue;
				}
				try {
					emitAverageRate(column.getValue(), RateParser.parse(row.get(column.getKey())), month);
				} catch (ValueParseException e) {
					skip(column.getValue() + " average rate for " + month, e);
				}
			}
		}
	}

	/**
	 * Emit the rates read from a PDF table. The n-th rate of a period belongs to the n-th term, empty
	 * columns are passed over.
	 *
	 * @throws ExtractionException if the PDF had no terms or no periods
	 */
	protected void emitPeriodRates(List<PdfRateTable.PeriodRates> periods, List<Term> terms) throws ExtractionException {
		if (terms.isEmpty()) {
			throw new ExtractionException("Could not find terms in PDF header");
		}
		if (periods.isEmpty()) {
			throw new ExtractionException("No rate data found in PDF");
		}
		for (var period : periods) {
			List<Double> rates = period.rates();
			for (int i = 0; i < rates.size() && i < terms.size(); i++) {
				if (rates.get(i) != null) {
					emitAverageRate(terms.get(i), rates.get(i), period.month());
				}
			}
		}
	}

	protected String fetch(String url) throws IOException, InterruptedException {
		fine("Fetching " + url);
		return fetcher.fetch(url);
	}

	protected String fetch(String url, Map<String, String> headers) throws IOException, InterruptedException {
		fine("Fetching " + url);
		return fetcher.fetch(url, headers);
	}

	protected byte[] fetchRaw(String url) throws IOException, InterruptedException {
		fine("Fetching " + url);
		return fetcher.fetchRaw(url);
	}

	protected JsonNode readJson(String json) throws IOException {
		return objectMapper.readTree(json);
	}
}
