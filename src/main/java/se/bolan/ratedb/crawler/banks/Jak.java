package se.bolan.ratedb.crawler.banks;

import java.util.List;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TextUtils;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Crawler for JAK Medlemsbank. One table per term, each row a month with its list rate and average
 * rate. The page leaves cells and rows unclosed, which the HTML5 parser repairs.
 */
public class Jak extends BaseCrawler {
	private static final String NAME = "jak";
	private static final String BANK = "JAK Medlemsbank";
	static final String URL = "https://www.jak.se/snittranta/";

	public Jak(CrawlerConfig config) {
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
		String html = fetch(URL);
		section(
				"3 month rates",
				() -> termTable(TableLocator.byTextBefore(html, "List- och snittränta 3 månader"), Term.THREE_MONTHS));
		section(
				"12 month rates",
				() -> termTable(TableLocator.byTextBefore(html, "List- och snittränta 12 månader"), Term.ONE_YEAR));
	}

	private void termTable(HtmlTable table, Term term) {
		// Tidsperiod | Listränta | Snittränta | Sparkrav, newest month first
		boolean first = true;
		for (List<String> row : table.rows()) {
			if (row.size() < 3) {
				continue;
			}
			AvgMonth month;
			try {
				month = DateParsers.yearSpaceMonth(row.get(0));
			} catch (ValueParseException e) {
				skip("month '" + row.get(0) + "'", e);
				continue;
			}
			if (first) {
				// Only the newest row holds the current list rate, it has no change date
				first = false;
				try {
					emitListRate(term, RateParser.parse(row.get(1)));
				} catch (ValueParseException e) {
					skip(term + " list rate", e);
				}
			}
			if (TextUtils.isPlaceholder(row.get(2))) {
				continue;
			}
			try {
				emitAverageRate(term, RateParser.parse(row.get(2)), month);
			} catch (ValueParseException e) {
				skip(term + " average rate for " + month, e);
			}
		}
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
			return new Jak(config);
		}
	}
}
