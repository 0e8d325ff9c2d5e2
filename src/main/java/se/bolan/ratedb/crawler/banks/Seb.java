package se.bolan.ratedb.crawler.banks;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.NotFoundException;
import se.bolan.ratedb.extract.payload.JsonPath;
import se.bolan.ratedb.extract.payload.PayloadShapeException;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Crawler for SEB. Rates are served by a JSON API that requires an API key. The key is not
 * published on its own, it is embedded in the JavaScript bundle of the public pricing portal, so
 * every crawl first looks up the bundle and reads the key from it.
 */
public class Seb extends BaseCrawler {
	private static final String NAME = "seb";
	private static final String BANK = "SEB";
	static final String PORTAL_URL = "https://pricing-portal-web-public.clouda.sebgroup.com/";
	static final String PORTAL_PAGE_URL = PORTAL_URL + "mortgage/averageratecurrent";
	static final String LIST_RATE_URL =
			"https://pricing-portal-api-public.clouda.sebgroup.com/public/mortgage/listrate/current";

	private static final Pattern BUNDLE = Pattern.compile("main\\.[a-zA-Z0-9]+\\.js");
	private static final Pattern API_KEY = Pattern.compile("x-api-key\":\"(.*?)\"");

	public Seb(CrawlerConfig config) {
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
		// Without a key no request can succeed
		String apiKey = apiKey();
		section("list rates", () -> listRates(readJson(fetch(LIST_RATE_URL, apiHeaders(apiKey)))));
	}

	private String apiKey() throws Exception {
		Matcher bundle = BUNDLE.matcher(fetch(PORTAL_PAGE_URL));
		if (!bundle.find()) {
			throw new NotFoundException("Could not find script bundle on pricing portal");
		}
		String bundleUrl = PORTAL_URL + bundle.group();
		logger.debug("Reading API key from {}", bundleUrl);
		Matcher key = API_KEY.matcher(fetch(bundleUrl));
		if (!key.find() || key.group(1).isBlank()) {
			throw new NotFoundException("Could not find API key in " + bundleUrl);
		}
		return key.group(1);
	}

	static Map<String, String> apiHeaders(String apiKey) {
		return Map.of(
				"X-API-Key", apiKey,
				"Referer", PORTAL_URL,
				"Origin", PORTAL_URL.substring(0, PORTAL_URL.length() - 1));
	}

	private void listRates(JsonNode response) throws PayloadShapeException {
		for (JsonNode rate : JsonPath.array(response)) {
			String termText = rate.path("adjustmentTerm").asText();
			try {
				Term term = TermParser.parse(termText);
				double value = rate.path("value").asDouble();
				LocalDate changedOn = startDate(rate.path("startDate").asText());
				emit(InterestSet.listRate(BANK, term, value).changedOn(changedOn));
			} catch (ValueParseException e) {
				skip("list rate " + termText, e);
			}
		}
	}

	/** Start dates come as a plain date or as a local timestamp */
	private static LocalDate startDate(String text) throws ValueParseException {
		int time = text.indexOf('T');
		return DateParsers.isoDate(time > 0 ? text.substring(0, time) : text);
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
			return new Seb(config);
		}
	}
}
