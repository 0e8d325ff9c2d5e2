package se.bolan.ratedb.crawler.banks;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.LinkFinder;
import se.bolan.ratedb.extract.NotFoundException;
import se.bolan.ratedb.extract.pdf.PdfRateTable;
import se.bolan.ratedb.extract.pdf.PdfText;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.RateType;
import se.bolan.ratedb.model.RatioDiscountBoundary;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.RateParser;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Crawler for Stabelo. Current rates come from the rate table widget, where each term is a button
 * showing the rate for the lowest loan-to-value bracket. Average rates are published as a PDF linked
 * from the rates page.
 */
public class Stabelo extends BaseCrawler {
	private static final String NAME = "stabelo";
	private static final String BANK = "Stabelo";
	static final String RATE_TABLE_URL = "https://api.stabelo.se/rate-table/";
	static final String AVERAGE_PAGE_URL = "https://www.stabelo.se/bolanerantor";
	private static final String SITE_URL = "https://www.stabelo.se/";

	/** The widget shows rates for loans up to 60% of the property value */
	static final RatioDiscountBoundary BUTTON_BRACKET = new RatioDiscountBoundary(0, 0.60);

	private static final List<String> STREAM_TERMS = List.of("3M", "1Y", "2Y", "3Y", "5Y", "10Y");

	public Stabelo(CrawlerConfig config) {
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
		section("rate table", () -> {
			String html = fetch(RATE_TABLE_URL);
			streamListRates(html);
			buttonRates(TableLocator.parse(html));
		});
		section("average rates", () -> {
			String pdfUrl = LinkFinder.find(
							fetch(AVERAGE_PAGE_URL), SITE_URL, ".pdf", List.of("genomsnitt", "snitt", "stabelo"))
					.orElseThrow(() -> new NotFoundException("Could not find average rates PDF link"));
			logger.debug("Found average rates PDF {}", pdfUrl);
			String text = PdfText.extract(fetchRaw(pdfUrl));
			List<Term> terms = PdfRateTable.headerTerms(text);
			emitPeriodRates(PdfRateTable.parse(text, terms.size(), PdfRateTable.Anchor.MONTH_NAME_YEAR), terms);
		});
	}

	/**
	 * The widget's embedded stream data holds list rates in basis points next to each term code. The
	 * highest value per term between 2% and 6% is the list rate.
	 */
	private void streamListRates(String html) {
		Map<Term, Integer> found = new LinkedHashMap<>();
		for (String code : STREAM_TERMS) {
			Matcher m = Pattern.compile("\"" + code + "\"[^\"]*?(\\d{3})").matcher(html);
			int max = 0;
			while (m.find()) {
				int bps = Integer.parseInt(m.group(1));
				if (bps >= 200 && bps <= 600 && bps > max) {
					max = bps;
				}
			}
			if (max > 0) {
				int bps = max;
				TermParser.tryParse(code).ifPresent(term -> found.put(term, bps));
			}
		}
		if (found.isEmpty()) {
			logger.debug("No list rates in rate table stream data");
		}
		found.forEach((term, bps) -> emitListRate(term, bps / 100.0));
	}

	private void buttonRates(Document document) throws NotFoundException {
		List<Element> buttons = document.select("button[value]");
		if (buttons.isEmpty()) {
			throw new NotFoundException("No rate buttons found in rate table");
		}
		for (Element button : buttons) {
			String code = button.attr("value");
			Term term;
			try {
				term = TermParser.parse(code);
			} catch (ValueParseException e) {
				logger.debug("Skipping button with unsupported term '{}'", code);
				continue;
			}
			Element rateSpan = button.select("span").stream()
					.filter(span -> span.text().trim().endsWith("%"))
					.findFirst()
					.orElse(null);
			if (rateSpan == null) {
				warn("No rate found in button " + code);
				continue;
			}
			try {
				emit(InterestSet.builder()
						.type(RateType.RATIO_DISCOUNTED_RATE)
						.term(term)
						.nominalRate(RateParser.parse(rateSpan.text()))
						.ratioDiscountBoundaries(BUTTON_BRACKET));
			} catch (ValueParseException e) {
				skip("rate of button " + code, e);
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
			return new Stabelo(config);
		}
	}
}
