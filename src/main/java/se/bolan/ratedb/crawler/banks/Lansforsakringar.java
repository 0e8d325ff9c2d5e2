package se.bolan.ratedb.crawler.banks;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.ExtractionException;
import se.bolan.ratedb.extract.pdf.PdfRateTable;
import se.bolan.ratedb.extract.pdf.PdfText;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Crawler for Länsförsäkringar. List rates come from an HTML table, average rates from a PDF where
 * every row starts with a YYYYMMDD date.
 */
public class Lansforsakringar extends BaseCrawler {
	private static final String NAME = "lansforsakringar";
	private static final String BANK = "Länsförsäkringar";
	static final String LIST_URL = "https://www.lansforsakringar.se/stockholm/privat/bank/bolan/bolaneranta/";
	static final String AVERAGE_PDF_URL =
			"https://www.lansforsakringar.se/osfiles/00000-bolanerantor-genomsnittliga.pdf";

	public Lansforsakringar(CrawlerConfig config) {
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
		section("list rates", () -> listRates(TableLocator.byTextBefore(fetch(LIST_URL), "Bindningstid")));
		section("average rates", () -> {
			String text = PdfText.extract(fetchRaw(AVERAGE_PDF_URL));
			List<Term> terms = PdfRateTable.headerTerms(text);
			fine("Found " + terms.size() + " terms in PDF header");
			emitPeriodRates(PdfRateTable.parse(text, terms.size(), PdfRateTable.Anchor.DATE_YYYYMMDD), terms);
		});
	}

	private void listRates(HtmlTable table) throws ExtractionException {
		// Column order varies, so find the rate and date columns by their headers
		int rateColumn = -1;
		int dateColumn = -1;
		for (int i = 0; i < table.header().size(); i++) {
			String header = table.header().get(i).toLowerCase(Locale.ROOT);
			if (header.contains("ränta") && !header.contains("ändring")) {
				rateColumn = i;
			}
			if (header.contains("datum")) {
				dateColumn = i;
			}
		}
		if (rateColumn == -1) {
			throw new ExtractionException("Could not find rate column in header " + table.header());
		}

		for (List<String> row : table.rows()) {
			if (row.size() <= rateColumn) {
				warn("Skipping row with insufficient columns: " + row);
				continue;
			}
			try {
				Term term = TermParser.parse(row.get(0));
				double rate = RateParser.parse(row.get(rateColumn));
				LocalDate changedOn = dateColumn >= 0 && dateColumn < row.size() ? changedOn(row.get(dateColumn)) : null;
				emit(InterestSet.listRate(BANK, term, rate).changedOn(changedOn));
			} catch (ValueParseException e) {
				skip("list rate row " + row, e);
			}
		}
	}

	private LocalDate changedOn(String text) {
		try {
			return DateParsers.isoDate(text);
		} catch (ValueParseException e) {
			fine("No change date: " + e.getMessage());
			return null;
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
			return new Lansforsakringar(config);
		}
	}
}
