package se.bolan.ratedb.crawler.banks;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import se.bolan.ratedb.crawler.BaseCrawler;
import se.bolan.ratedb.crawler.CrawlerConfig;
import se.bolan.ratedb.crawler.SiteCrawler;
import se.bolan.ratedb.extract.payload.JsonPath;
import se.bolan.ratedb.extract.payload.PayloadBlob;
import se.bolan.ratedb.extract.payload.PayloadShapeException;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.TextUtils;

/**
 * Crawler for Nordax Bank. Average rates are a table block inside the Next.js page props of the
 * average rates page.
 */
public class Nordax extends BaseCrawler {
	private static final String NAME = "nordax";
	private static final String BANK = "Nordax Bank";
	static final String URL = "https://www.nordax.se/lana/bolan/genomsnittsrantor";

	public Nordax(CrawlerConfig config) {
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
			List<List<String>> rows = tableRows(readJson(PayloadBlob.nextData(fetch(URL))));
			if (rows.isEmpty()) {
				throw new PayloadShapeException("Average rate table is empty");
			}
			// Datum | 3 månaders | 36 månaders | 60 månaders
			emitAverageRows(rows.subList(1, rows.size()), termColumns(rows.get(0), 1), DateParsers::yearMonthDashed);
		});
	}

	static List<List<String>> tableRows(JsonNode nextData) throws PayloadShapeException {
		JsonNode block = JsonPath.navigate(
				nextData, "props", "pageProps", "page", "content", 0, "expandableContent", 0, "body", 0);
		if (!"table".equals(block.path("_type").asText())) {
			throw new PayloadShapeException("Expected a table block but found '" + block.path("_type").asText() + "'");
		}
		List<List<String>> rows = new ArrayList<>();
		for (JsonNode row : JsonPath.array(block, "content", "rows")) {
			List<String> cells = new ArrayList<>();
			for (JsonNode cell : row.path("cells")) {
				cells.add(TextUtils.normalizeSpaces(cell.asText()));
			}
			rows.add(cells);
		}
		return rows;
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
			return new Nordax(config);
		}
	}
}
