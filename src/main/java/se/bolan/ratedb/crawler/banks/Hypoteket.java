package se.bolan.ratedb.crawler.banks;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.payload.IndexedPayload;
import se.bolan.ratedb.extract.payload.PayloadShapeException;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Crawler for Hypoteket. Both list and average rates come from the flat, index-referenced state
 * payload of the rates page.
 */
public class Hypoteket extends BaseCrawler {
	private static final String NAME = "hypoteket";
	private static final String BANK = "Hypoteket";
	static final String URL = "https://hypoteket.com/borantor/_payload.json";

	/** Term names used both as list rate terms and as average rate field names */
	private static final Map<String, Term> TERMS = new LinkedHashMap<>();

	static {
		TERMS.put("threeMonth", Term.THREE_MONTHS);
		TERMS.put("sixMonth", Term.SIX_MONTHS);
		TERMS.put("oneYear", Term.ONE_YEAR);
		TERMS.put("twoYear", Term.TWO_YEARS);
		TERMS.put("threeYear", Term.THREE_YEARS);
		TERMS.put("fourYear", Term.FOUR_YEARS);
		TERMS.put("fiveYear", Term.FIVE_YEARS);
		TERMS.put("sevenYear", Term.SEVEN_YEARS);
		TERMS.put("tenYear", Term.TEN_YEARS);
	}

	public Hypoteket(CrawlerConfig config) {
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
		IndexedPayload payload = IndexedPayload.of(readJson(fetch(URL)));
		section("list rates", () -> listRates(payload));
		section("average rates", () -> averageRates(payload));
	}

	private void listRates(IndexedPayload payload) throws PayloadShapeException {
		JsonNode data = payload.resolve(2);
		if (!data.isObject() || !data.has("interest-rates")) {
			throw new PayloadShapeException("No interest-rates in payload data object");
		}
		JsonNode references = payload.deref(data.get("interest-rates"));
		for (JsonNode entry : payload.derefAll(references)) {
			Optional<String> termName = payload.stringField(entry, "interestTerm");
			Optional<Double> rate = payload.numberField(entry, "rate");
			if (termName.isEmpty() || rate.isEmpty()) {
				fine("Skipping incomplete list rate entry " + entry);
				continue;
			}
			Term term = TERMS.get(termName.get());
			if (term == null) {
				skip("list rate", new ValueParseException("Unsupported term '" + termName.get() + "'"));
				continue;
			}
			emit(InterestSet.listRate(BANK, term, rate.get()).changedOn(validFrom(payload, entry)));
		}
	}

	private LocalDate validFrom(IndexedPayload payload, JsonNode entry) {
		Optional<String> validFrom = payload.stringField(entry, "validFrom");
		if (validFrom.isEmpty()) {
			return null;
		}
		try {
			return DateParsers.isoDateTime(validFrom.get());
		} catch (ValueParseException e) {
			warn("Ignoring change date: " + e.getMessage());
			return null;
		}
	}

	private void averageRates(IndexedPayload payload) {
		for (JsonNode entry : payload.objectsWithKey("monthPeriod")) {
			Optional<String> period = payload.stringField(entry, "monthPeriod");
			if (period.isEmpty()) {
				continue;
			}
			AvgMonth month;
			try {
				month = DateParsers.yearMonthDashed(period.get());
			} catch (ValueParseException e) {
				skip("average rate period", e);
				continue;
			}
			for (var term : TERMS.entrySet()) {
				payload.numberField(entry, term.getKey())
						.ifPresent(rate -> emitAverageRate(term.getValue(), rate, month));
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
			return new Hypoteket(config);
		}
	}
}
