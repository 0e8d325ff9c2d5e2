package se.bolan.ratedb.crawler.banks;

import com.fasterxml.jackson.databind.JsonNode;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.payload.JsonPath;
import se.bolan.ratedb.extract.payload.PayloadShapeException;
import se.bolan.ratedb.extract.table.HtmlTable;
import se.bolan.ratedb.extract.table.TableLocator;
import se.bolan.ratedb.util.DateParsers;

/**
 * Crawler for Marginalen Bank. The average rate table is HTML embedded in the page content returned
 * by the bank's Episerver content API.
 */
public class Marginalen extends BaseCrawler {
	private static final String NAME = "marginalen";
	private static final String BANK = "Marginalen Bank";
	static final String URL = "https://www.marginalen.se/api/episerver/v3.0/content"
			+ "?contentUrl=%2Fprivat%2Fbanktjanster%2Flan%2Fflytta-eller-utoka-bolan%2Fgenomsnittlig-bolaneranta%2F"
			+ "&matchExact=true&expand=*";

	public Marginalen(CrawlerConfig config) {
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
		section("average rates", () -> {
			String html = contentBody(readJson(fetch(URL)));
			HtmlTable table = TableLocator.byTextBefore(html, "Genomsnittlig bolåneränta");
			// Period as YYYYMM, then one column per term
			emitAverageRows(table.rows(), termColumns(table.header(), 1), DateParsers::yearMonthCompact);
		});
	}

	static String contentBody(JsonNode response) throws PayloadShapeException {
		JsonNode body = JsonPath.navigate(response, 0, "mainContentArea", 0, "mainContentArea", 0, "body");
		if (!body.isTextual() || body.asText().isBlank()) {
			throw new PayloadShapeException("Empty HTML body in content response");
		}
		return body.asText();
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
			return new Marginalen(config);
		}
	}
}
