package se.bolan.ratedb.crawler.banks;

import java.util.List;
import java.util.Map;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.ExtractionException;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.RowSanitizer;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.ValueParseException;

/** Crawler for Danske Bank, list and average rates from one HTML page */
public class DanskeBank extends BaseCrawler {
	private static final String NAME = "danske-bank";
	private static final String BANK = "Danske Bank";
	static final String URL = "https://danskebank.se/privat/produkter/bolan/relaterat/aktuella-bolanerantor";

	public DanskeBank(CrawlerConfig config) {
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
		section("list rates", () -> listRates(TableLocator.byTextBefore(html, "Bankens aktuella")));
		section("average rates", () -> averageRates(TableLocator.byFirstHeader(html, "Månad")));
	}

	private void listRates(HtmlTable table) {
		// Bindningstid | Ränta | Senast ändrad, plus Premium rows that only apply to some customers
		for (List<String> row : table.rows()) {
			if (row.isEmpty() || row.get(0).contains("Premium")) {
				continue;
			}
			if (row.size() < 2) {
				warn("Skipping row with insufficient columns: " + row);
				continue;
			}
			try {
				Term term = TermParser.parse(row.get(0));
				InterestSet.Builder builder = InterestSet.listRate(BANK, term, RateParser.parse(row.get(1)));
				if (row.size() > 2) {
					try {
						builder.changedOn(DateParsers.isoDate(row.get(2)));
					} catch (ValueParseException e) {
						logger.debug("Ignoring change date '" + row.get(2) + "': " + e.getMessage());
					}
				}
				emit(builder);
			} catch (ValueParseException e) {
				skip("list rate row " + row, e);
			}
		}
	}

	private void averageRates(HtmlTable table) throws ExtractionException {
		// The page sometimes puts the month in a row of its own above the rates
		List<List<String>> rows = RowSanitizer.mergeSplitRows(table.rows(), DateParsers::monthNameYear);
		Map<Integer, Term> columns = termColumns(table.header(), 1);
		emitAverageRows(rows, columns, DateParsers::monthNameYear);
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
			return new DanskeBank(config);
		}
	}
}
