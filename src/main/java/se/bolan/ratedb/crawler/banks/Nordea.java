package se.bolan.ratedb.crawler.banks;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.ExtractionException;
import se.bolan.ratedb.extract.LinkFinder;
import se.bolan.ratedb.extract.NotFoundException;
import se.bolan.ratedb.extract.sheet.SheetCell;
import se.bolan.ratedb.extract.sheet.SheetReader;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Crawler for Nordea. List rates come from an HTML table, average rates from the historic rate
 * workbook linked on a separate page. The workbook holds one row per rate change day, each is
 * reported for the month it falls in.
 */
public class Nordea extends BaseCrawler {
	private static final String NAME = "nordea";
	private static final String BANK = "Nordea";
	static final String LIST_URL = "https://www.nordea.se/privat/produkter/bolan/listrantor.html";
	static final String HISTORIC_URL = "https://www.nordea.se/privat/produkter/bolan/historiska-bolanerantor.html";
	private static final String BASE_URL = "https://www.nordea.se/";

	private static final List<String> SHEET_KEYWORDS = List.of("ränteändring", "ranteandring", "historisk");
	private static final List<String> HEADER_KEYWORDS = List.of("ränteändringsdag", "ranteandring", "datum");

	public Nordea(CrawlerConfig config) {
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
		section("list rates", () -> listRates(TableLocator.byTextBefore(fetch(LIST_URL), "Listräntor för bolån")));
		section("historic rates", this::historicRates);
	}

	private void listRates(HtmlTable table) {
		// Bindningstid | Ränta | Ändring | Senast ändrad
		for (List<String> row : table.rows()) {
			if (row.size() < 4) {
				warn("Skipping row with insufficient columns: " + row);
				continue;
			}
			try {
				Term term = TermParser.parse(row.get(0));
				double rate = RateParser.parse(row.get(1));
				emit(InterestSet.listRate(BANK, term, rate).changedOn(DateParsers.isoDate(row.get(3))));
			} catch (ValueParseException e) {
				skip("list rate row " + row, e);
			}
		}
	}

	private void historicRates() throws Exception {
		String page = fetch(HISTORIC_URL);
		String xlsxUrl = LinkFinder.find(page, BASE_URL, ".xlsx", List.of())
				.orElseThrow(() -> new NotFoundException("No workbook link on historic rates page"));
		fine("Found historic rates workbook " + xlsxUrl);
		emitHistoricRows(SheetReader.read(fetchRaw(xlsxUrl), SHEET_KEYWORDS));
	}

	private void emitHistoricRows(List<List<SheetCell>> rows) throws ExtractionException {
		int headerIndex = headerRow(rows);
		List<SheetCell> header = rows.get(headerIndex);

		int dateColumn = 0;
		Map<Integer, Term> columns = new LinkedHashMap<>();
		for (int i = 0; i < header.size(); i++) {
			String cell = header.get(i).text().toLowerCase(Locale.ROOT);
			if (cell.contains("ränteändringsdag") || cell.contains("datum")) {
				dateColumn = i;
				break;
			}
		}
		for (int i = 1; i < header.size(); i++) {
			Optional<Term> term = TermParser.tryParse(header.get(i).text());
			if (term.isPresent()) {
				columns.put(i, term.get());
			} else if (!header.get(i).isBlank()) {
				logger.debug("Skipping workbook header column '" + header.get(i) + "'");
			}
		}
		if (columns.isEmpty()) {
			throw new ExtractionException("No term columns found in workbook header " + header);
		}

		for (List<SheetCell> row : rows.subList(headerIndex + 1, rows.size())) {
			if (row.size() <= dateColumn) {
				continue;
			}
			// Rows without a date are notes and blank lines below the data
			Optional<LocalDate> date = changeDate(row.get(dateColumn));
			if (date.isEmpty()) {
				continue;
			}
			AvgMonth month = AvgMonth.of(YearMonth.from(date.get()));
			for (var column : columns.entrySet()) {
				if (column.getKey() >= row.size() || row.get(column.getKey()).isBlank()) {
					continue;
				}
				SheetCell cell = row.get(column.getKey());
				try {
					double rate = cell.isNumber() ? cell.number().doubleValue() : RateParser.parse(cell.text());
					emitAverageRate(column.getValue(), rate, month);
				} catch (ValueParseException e) {
					skip(column.getValue() + " rate for " + date.get(), e);
				}
			}
		}
	}

	/** First row with a date heading in one of its first three cells */
	private static int headerRow(List<List<SheetCell>> rows) throws NotFoundException {
		for (int i = 0; i < rows.size(); i++) {
			List<SheetCell> row = rows.get(i);
			for (int j = 0; j < row.size() && j < 3; j++) {
				String cell = row.get(j).text().toLowerCase(Locale.ROOT);
				if (HEADER_KEYWORDS.stream().anyMatch(cell::contains)) {
					return i;
				}
			}
		}
		throw new NotFoundException("Could not find header row in workbook");
	}

	/** Dates are either {@code MM-DD-YY} text or Excel serial numbers */
	private static Optional<LocalDate> changeDate(SheetCell cell) {
		if (cell.isNumber()) {
			return cell.serialDate();
		}
		try {
			return Optional.of(DateParsers.monthDayShortYear(cell.text()));
		} catch (ValueParseException e) {
			return Optional.empty();
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
			return new Nordea(config);
		}
	}
}
