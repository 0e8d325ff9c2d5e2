package se.bolan.ratedb.crawler.banks;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.payload.PayloadShapeException;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.ValueParseException;

/** Crawler for Handelsbanken, list and average rates from the bank's JSON API */
public class Handelsbanken extends BaseCrawler {
	private static final String NAME = "handelsbanken";
	private static final String BANK = "Handelsbanken";
	static final String LIST_URL =
			"https://www.handelsbanken.se/tron/slana/slan/service/mortgagerates/v1/interestrates";
	static final String AVERAGE_URL =
			"https://www.handelsbanken.se/tron/slana/slan/service/mortgagerates/v1/averagerates";

	private static final ObjectMapper objectMapper = new ObjectMapper();

	@JsonIgnoreProperties(ignoreUnknown = true)
	record RateValue(@JsonProperty("value") String value, @JsonProperty("valueRaw") Double valueRaw) {}

	/** A rate for a term given as a count of months ("3") or years ("4") */
	@JsonIgnoreProperties(ignoreUnknown = true)
	record Rate(
			@JsonProperty("periodBasisType") String periodBasisType,
			@JsonProperty("term") String term,
			@JsonProperty("rateValue") RateValue rateValue) {}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record ListRates(@JsonProperty("interestRates") List<Rate> interestRates) {}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record AveragePeriod(@JsonProperty("period") String period, @JsonProperty("rates") List<Rate> rates) {}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record AverageRates(@JsonProperty("averageRatePeriods") List<AveragePeriod> averageRatePeriods) {}

	public Handelsbanken(CrawlerConfig config) {
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
			ListRates response = objectMapper.readValue(fetch(LIST_URL), ListRates.class);
			if (response.interestRates() == null) {
				throw new PayloadShapeException("No interestRates in response");
			}
			// The API has no change dates
			for (Rate rate : response.interestRates()) {
				try {
					emitListRate(term(rate), value(rate));
				} catch (ValueParseException e) {
					skip("list rate", e);
				}
			}
		});
		section("average rates", () -> {
			AverageRates response = objectMapper.readValue(fetch(AVERAGE_URL), AverageRates.class);
			if (response.averageRatePeriods() == null) {
				throw new PayloadShapeException("No averageRatePeriods in response");
			}
			for (AveragePeriod period : response.averageRatePeriods()) {
				AvgMonth month;
				try {
					month = DateParsers.yearMonthCompact(period.period());
				} catch (ValueParseException e) {
					skip("average rate period", e);
					continue;
				}
				for (Rate rate : period.rates() != null ? period.rates() : List.<Rate>of()) {
					try {
						emitAverageRate(term(rate), value(rate), month);
					} catch (ValueParseException e) {
						skip("average rate for " + month, e);
					}
				}
			}
		});
	}

	private static Term term(Rate rate) throws ValueParseException {
		try {
			return TermParser.fromPeriodBasis(rate.periodBasisType(), Integer.parseInt(rate.term()));
		} catch (NumberFormatException e) {
			throw new ValueParseException("Unsupported term count: '" + rate.term() + "'", e);
		}
	}

	private static double value(Rate rate) throws ValueParseException {
		if (rate.rateValue() == null || rate.rateValue().valueRaw() == null) {
			throw new ValueParseException("Rate has no value");
		}
		return rate.rateValue().valueRaw();
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
			return new Handelsbanken(config);
		}
	}
}
