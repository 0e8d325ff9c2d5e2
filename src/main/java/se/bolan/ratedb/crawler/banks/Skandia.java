package se.bolan.ratedb.crawler.banks;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.ExtractionException;
import se.bolan.ratedb.extract.payload.PayloadBlob;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.SwedishMonths;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.TextUtils;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Crawler for Skandia. Both rate pages are rendered from a CMS model assigned to {@code
 * SKB.pageContent} in an inline script. Tables in that model are column lists whose cells hold small
 * HTML fragments.
 */
public class Skandia extends BaseCrawler {
	private static final String NAME = "skandia";
	private static final String BANK = "Skandia";
	static final String LIST_URL = "https://www.skandia.se/lana/bolan/bolanerantor/";
	static final String AVERAGE_URL = "https://www.skandia.se/lana/bolan/bolanerantor/snittrantor/";

	static final Pattern PAGE_CONTENT =
			Pattern.compile("SKB\\.pageContent\\s*=\\s*(\\{.*?\\});?\\s*(?:SKB\\.|</script>)", Pattern.DOTALL);
	private static final Pattern MONTH_YEAR =
			Pattern.compile("(" + SwedishMonths.pattern() + ")\\s+(\\d{4})", Pattern.CASE_INSENSITIVE);

	public Skandia(CrawlerConfig config) {
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
			JsonNode content = pageContent(fetch(LIST_URL));
			int found = 0;
			for (JsonNode block : blocks(content.path("sectionContent2"))) {
				if (isTable(block) && headerText(block).contains("Listräntor")) {
					listRates(block.path("columns"));
					found++;
				}
			}
			if (found == 0) {
				throw new ExtractionException("No list rate table in page content");
			}
		});
		section("average rates", () -> {
			JsonNode content = pageContent(fetch(AVERAGE_URL));
			List<JsonNode> blocks = new ArrayList<>(blocks(content.path("sectionContent1")));
			blocks.addAll(blocks(content.path("sectionContent2")));
			for (JsonNode block : blocks) {
				averageBlock(block);
			}
		});
	}

	private JsonNode pageContent(String html) throws Exception {
		return readJson(PayloadBlob.extract(html, PAGE_CONTENT));
	}

	/**
	 * The current month is a table with the month in its header. Earlier months are tables inside
	 * accordion items or inside FAQ answers, where the question names the month.
	 */
	private void averageBlock(JsonNode block) {
		if (isTable(block) && headerText(block).contains("Snitträntor")) {
			averageTable(headerText(block), block.path("columns"));
		}
		if (hasType(block, "AccordionBlock")) {
			for (JsonNode item : blocks(block.path("items"))) {
				if (isTable(item) && !headerText(item).isEmpty()) {
					averageTable(headerText(item), item.path("columns"));
				}
			}
		}
		if (hasType(block, "FAQBlock")) {
			for (JsonNode question : blocks(block.path("questions"))) {
				String label = question.path("question").asText();
				for (JsonNode nested : blocks(question.path("blocks"))) {
					if (isTable(nested)) {
						averageTable(label, nested.path("columns"));
					}
				}
			}
		}
	}

	private void listRates(JsonNode columns) {
		List<String> terms = column(columns, "bindningstid");
		List<String> rates = column(columns, "listränta");
		List<String> dates = column(columns, "ändrad");
		for (int i = 0; i < terms.size() && i < rates.size(); i++) {
			try {
				Term term = TermParser.parse(terms.get(i));
				var builder = InterestSet.listRate(BANK, term, RateParser.parse(rates.get(i)));
				if (i < dates.size()) {
					try {
						builder.changedOn(DateParsers.isoDate(dates.get(i)));
					} catch (ValueParseException e) {
						logger.debug("No change date for {}: {}", term, e.getMessage());
					}
				}
				emit(builder);
			} catch (ValueParseException e) {
				skip("list rate row " + terms.get(i), e);
			}
		}
	}

	private void averageTable(String label, JsonNode columns) {
		AvgMonth month;
		try {
			month = monthOf(label);
		} catch (ValueParseException e) {
			skip("average table '" + label + "'", e);
			return;
		}
		List<String> terms = column(columns, "bindningstid");
		List<String> rates = column(columns, "snittränta");
		for (int i = 0; i < terms.size() && i < rates.size(); i++) {
			try {
				emitAverageRate(TermParser.parse(terms.get(i)), RateParser.parse(rates.get(i)), month);
			} catch (ValueParseException e) {
				skip("average rate " + terms.get(i) + " for " + month, e);
			}
		}
	}

	/** The month named somewhere in a heading such as "Snitträntor november 2025" */
	static AvgMonth monthOf(String label) throws ValueParseException {
		Matcher m = MONTH_YEAR.matcher(TextUtils.normalizeSpaces(label));
		if (!m.find()) {
			throw new ValueParseException("No month in '" + label + "'");
		}
		return DateParsers.monthNameYear(m.group(1) + " " + m.group(2));
	}

	/** Cell texts of the first column whose header contains the given word */
	private static List<String> column(JsonNode columns, String header) {
		for (JsonNode column : blocks(columns)) {
			String cellHeader = column.path("cellHeader").asText().toLowerCase(Locale.ROOT);
			if (cellHeader.contains(header)) {
				List<String> cells = new ArrayList<>();
				for (JsonNode cell : column.path("cells")) {
					cells.add(TextUtils.normalizeSpaces(Jsoup.parse(cell.asText()).text()));
				}
				return cells;
			}
		}
		return List.of();
	}

	/** The expanded CMS blocks of a content area, skipping references that were not expanded */
	private static List<JsonNode> blocks(JsonNode area) {
		List<JsonNode> blocks = new ArrayList<>();
		for (JsonNode entry : area) {
			JsonNode expanded = entry.path("contentLink").path("expanded");
			if (expanded.isObject()) {
				blocks.add(expanded);
			}
		}
		return blocks;
	}

	private static boolean isTable(JsonNode block) {
		return hasType(block, "TableBlock");
	}

	private static boolean hasType(JsonNode block, String type) {
		for (JsonNode contentType : block.path("contentType")) {
			if (contentType.asText().equals(type)) {
				return true;
			}
		}
		return false;
	}

	private static String headerText(JsonNode block) {
		return TextUtils.normalizeSpaces(block.path("header").path("headerText").asText());
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
			return new Skandia(config);
		}
	}
}
