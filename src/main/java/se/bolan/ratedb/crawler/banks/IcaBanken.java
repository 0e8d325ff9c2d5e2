package se.bolan.ratedb.crawler.banks;

import java.util.List;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.ValueParseException;

/** Crawler for ICA Banken, list and average rates from one HTML page */
public class IcaBanken extends BaseCrawler {
	private static final String NAME = "ica-banken";
	private static final String BANK = "ICA Banken";
	static final String URL = "https://www.icabanken.se/lana/bolan/bolanerantor/";

	// Columns after the month: 3 mån | 1 år | 2 år | 3 år | 4 år | 5 år | 7 år | 10 år
	private static final List<Term> AVERAGE_TERMS = List.of(
			Term.THREE_MONTHS,
			Term.ONE_YEAR,
			Term.TWO_YEARS,
			Term.THREE_YEARS,
			Term.FOUR_YEARS,
			Term.FIVE_YEARS,
			Term.SEVEN_YEARS,
			Term.TEN_YEARS);

	public IcaBanken(CrawlerConfig config) {
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
		section("list rates", () -> listRates(TableLocator.byTextBefore(html, "Aktuella bolåneräntor")));
		section("average rates", () -> averageRates(TableLocator.byTextBefore(html, "Snitträntor för bolån")));
	}

	private void listRates(HtmlTable table) {
		// Bindningstid | Ränta | Senast ändrad
		for (List<String> row : table.rows()) {
			if (row.size() < 3) {
				warn("Skipping row with insufficient columns: " + row);
				continue;
			}
			try {
				Term term = TermParser.parse(row.get(0));
				double rate = RateParser.parse(row.get(1));
				emit(InterestSet.listRate(BANK, term, rate).changedOn(DateParsers.isoDate(row.get(2))));
			} catch (ValueParseException e) {
				skip("list rate row " + row, e);
			}
		}
	}

	private void averageRates(HtmlTable table) {
		for (List<String> row : table.rows()) {
			if (row.size() < 2) {
				continue;
			}
			AvgMonth month;
			try {
				month = DateParsers.yearSpaceMonth(row.get(0));
			} catch (ValueParseException e) {
				skip("average month " + row.get(0), e);
				continue;
			}
			for (int col = 1; col < row.size() && col <= AVERAGE_TERMS.size(); col++) {
				String cell = row.get(col);
				// "-*" marks months with too few loans
				if (cell.contains("-") || cell.contains("*")) {
					continue;
				}
				try {
					emitAverageRate(AVERAGE_TERMS.get(col - 1), RateParser.parse(cell), month);
				} catch (ValueParseException e) {
					skip("average rate for " + month, e);
				}
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
			return new IcaBanken(config);
		}
	}
}
