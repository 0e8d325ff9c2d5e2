package se.bolan.ratedb.crawler.banks;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.ValueParseException;

/** Crawler for Swedbank, list rates and historic average rates from two HTML pages */
public class Swedbank extends BaseCrawler {
	private static final String NAME = "swedbank";
	private static final String BANK = "Swedbank";
	static final String LIST_URL = "https://www.swedbank.se/privat/boende-och-bolan/bolanerantor.html";
	static final String AVERAGE_URL =
			"https://www.swedbank.se/privat/boende-och-bolan/bolanerantor/historiska-genomsnittsrantor.html";

	private static final Pattern CHANGED_ON =
			Pattern.compile("senast ändrad (\\d{1,2} \\p{L}+\\.? \\d{4})", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

	public Swedbank(CrawlerConfig config) {
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
		section("list rates", () -> {
			String html = fetch(LIST_URL);
			listRates(TableLocator.byTextBefore(html, "Aktuella bolåneräntor – listpris"));
		});
		section("average rates", () -> {
			String html = fetch(AVERAGE_URL);
			HtmlTable table = TableLocator.byCaption(html, "Våra historiska genomsnittsräntor");
			Map<Integer, Term> columns = termColumns(table.header(), 1);
			columns.keySet().removeIf(i -> isBankLoan(table.headerCell(i)));
			emitAverageRows(table.rows(), columns, DateParsers::monthNameYear);
		});
	}

	private void listRates(HtmlTable table) {
		// The change date is only given once, in the rate column header
		LocalDate changedOn = null;
		Matcher m = CHANGED_ON.matcher(table.headerCell(1));
		if (m.find()) {
			try {
				changedOn = DateParsers.dayMonthNameYear(m.group(1));
			} catch (ValueParseException e) {
				warn("Failed to parse change date from header '" + table.headerCell(1) + "': " + e.getMessage());
			}
		} else {
			warn("No change date in header '" + table.headerCell(1) + "'");
		}

		for (List<String> row : table.rows()) {
			if (row.size() < 2) {
				warn("Skipping row with insufficient columns: " + row);
				continue;
			}
			if (isBankLoan(row.get(0))) {
				continue;
			}
			try {
				Term term = TermParser.parse(row.get(0));
				emit(InterestSet.listRate(BANK, term, RateParser.parse(row.get(1))).changedOn(changedOn));
			} catch (ValueParseException e) {
				skip("list rate row " + row, e);
			}
		}
	}

	private static boolean isBankLoan(String text) {
		return text.toLowerCase(Locale.ROOT).contains("banklån");
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
			return new Swedbank(config);
		}
	}
}
