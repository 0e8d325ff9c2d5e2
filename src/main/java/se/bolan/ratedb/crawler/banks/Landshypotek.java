package se.bolan.ratedb.crawler.banks;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.ExtractionException;
import se.bolan.ratedb.extract.NotFoundException;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.RateType;
import se.bolan.ratedb.model.RatioDiscountBoundary;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.SwedishMonths;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.TextUtils;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Crawler for Landshypotek. A single page carries everything: the discounted rates per loan-to-value
 * tier in captioned tables, and list rates, this month's average rates and the average rate history
 * in accordion sections.
 */
public class Landshypotek extends BaseCrawler {
	private static final String NAME = "landshypotek";
	private static final String BANK = "Landshypotek";
	static final String URL = "https://www.landshypotek.se/lana/bolanerantor/";

	static final RatioDiscountBoundary UP_TO_60 = new RatioDiscountBoundary(0, 0.60);
	static final RatioDiscountBoundary UP_TO_75 = new RatioDiscountBoundary(0.60, 0.75);

	public Landshypotek(CrawlerConfig config) {
		super(config);
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	protected String bank() {
		return BANK;
	}

	@Override
	protected void scrape() throws Exception {
		Document document = TableLocator.parse(fetch(URL));
		section("discounted rates up to 60%", () -> discountedRates(document, "belåningsgrad 60", UP_TO_60));
		section("discounted rates up to 75%", () -> discountedRates(document, "belåningsgrad 75", UP_TO_75));
		section("list rates", () -> listRates(document));
		section("current average rates", () -> currentAverageRates(document));
		section("historical average rates", () -> historicalAverageRates(document));
	}

	private void discountedRates(Document document, String caption, RatioDiscountBoundary bracket)
			throws NotFoundException {
		// Bindningstid | Ränta | Effektiv ränta
		HtmlTable table = HtmlTable.parse(TableLocator.findByCaption(document, caption));
		for (List<String> row : table.rows()) {
			if (row.size() < 2) {
				continue;
			}
			try {
				emit(InterestSet.builder()
						.type(RateType.RATIO_DISCOUNTED_RATE)
						.term(TermParser.parse(row.get(0)))
						.nominalRate(RateParser.parse(row.get(1)))
						.ratioDiscountBoundaries(bracket));
			} catch (ValueParseException e) {
				skip("discounted rate row " + row, e);
			}
		}
	}

	private void listRates(Document document) throws NotFoundException {
		// Bindningstid | Ränta | Effektiv ränta | Ändrad
		HtmlTable table = HtmlTable.parse(TableLocator.findByTextBefore(document, "Listräntor för bolån", 0));
		for (List<String> row : table.rows()) {
			if (row.size() < 2) {
				continue;
			}
			try {
				Term term = TermParser.parse(row.get(0));
				var builder = InterestSet.listRate(BANK, term, RateParser.parse(row.get(1)));
				if (row.size() > 3 && !row.get(3).isBlank()) {
					try {
						builder.changedOn(DateParsers.dayMonthNameYear(row.get(3)));
					} catch (ValueParseException e) {
						logger.debug("No change date for {}: {}", term, e.getMessage());
					}
				}
				emit(builder);
			} catch (ValueParseException e) {
				skip("list rate row " + row, e);
			}
		}
	}

	/** The table names its month without a year, which is taken from the crawl time */
	private void currentAverageRates(Document document) throws ExtractionException {
		String anchor = "Snitträntor för bolån senaste månaden";
		String heading = headingAfter(document, anchor);
		AvgMonth month;
		try {
			month = inferYear(heading, LocalDate.ofInstant(crawlTime, ZoneOffset.UTC));
		} catch (ValueParseException e) {
			throw new ExtractionException("No month in heading '" + heading + "'", e);
		}
		HtmlTable table = HtmlTable.parse(TableLocator.findByTextBefore(document, anchor, 0));
		for (List<String> row : table.rows()) {
			if (row.size() < 2 || TextUtils.isPlaceholder(row.get(1))) {
				continue;
			}
			try {
				emitAverageRate(TermParser.parse(row.get(0)), RateParser.parse(row.get(1)), month);
			} catch (ValueParseException e) {
				skip("average rate row " + row, e);
			}
		}
	}

	/** År | Månad | one column per term */
	private void historicalAverageRates(Document document) throws ExtractionException {
		HtmlTable table =
				HtmlTable.parse(TableLocator.findByTextBefore(document, "Historisk snittränta för bolån", 0));
		if (table.header().size() < 3) {
			throw new ExtractionException("Expected year, month and term columns but got " + table.header());
		}
		// Join year and month into one label so the rows read like any other average table
		List<List<String>> rows = new ArrayList<>();
		for (List<String> row : table.rows()) {
			if (row.size() < 3) {
				continue;
			}
			List<String> joined = new ArrayList<>();
			joined.add(row.get(0) + " " + row.get(1));
			joined.addAll(row.subList(2, row.size()));
			rows.add(joined);
		}
		List<String> header = table.header().subList(1, table.header().size());
		emitAverageRows(rows, termColumns(header, 1), DateParsers::yearMonthName);
	}

	/** Text of the first {@code <h4>} following the element whose own text holds the anchor */
	static String headingAfter(Document document, String anchor) throws NotFoundException {
		boolean anchorSeen = false;
		for (Element element : document.getAllElements()) {
			if (!anchorSeen) {
				anchorSeen = TextUtils.normalizeSpaces(element.ownText()).contains(anchor);
			} else if (element.normalName().equals("h4")) {
				return TextUtils.normalizeSpaces(element.text());
			}
		}
		throw new NotFoundException("Failed to find month heading after '" + anchor + "'");
	}

	/** A month later in the year than the crawl date belongs to the previous year */
	static AvgMonth inferYear(String monthName, LocalDate crawlDate) throws ValueParseException {
		int month = SwedishMonths.lookup(monthName);
		if (month == 0) {
			throw new ValueParseException("Unknown month '" + monthName + "'");
		}
		int year = month > crawlDate.getMonthValue() ? crawlDate.getYear() - 1 : crawlDate.getYear();
		return new AvgMonth(year, month);
	}

	public static class Discovery implements SiteCrawler.Discovery {
		@Override
		public String name() {
			return NAME;
		}

		@Override
		public String bank() {
			return BANK;
		}

		@Override
		public SiteCrawler create(CrawlerConfig config) {
			return new Landshypotek(config);
		}
	}
}
