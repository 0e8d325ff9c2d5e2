package se.bolan.ratedb.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Request headers that make a fetch look like it comes from a desktop Chrome browser. The
 * User-Agent and Sec-Ch-Ua headers always carry the same major version.
 */
public class BrowserHeaders {
	static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,image/apng,"
			+ "*/*;q=0.8,application/signed-exchange;v=b3;q=0.9,application/json";
	static final String ACCEPT_LANGUAGE = "sv-SE,sv;q=0.9,en-US;q=0.8,en;q=0.7";

	private final Random random;

	public BrowserHeaders() {
		this(new Random());
	}

	BrowserHeaders(Random random) {
		this.random = random;
	}

	/** Create a fresh set of default headers with a randomly picked browser version */
	public Map<String, String> create() {
		int major = 120 + random.nextInt(25);
		var headers = new LinkedHashMap<String, String>();
		headers.put("Accept", ACCEPT);
		headers.put("Accept-Language", ACCEPT_LANGUAGE);
		headers.put("Cache-Control", "no-cache");
		headers.put("User-Agent", userAgent(major));
		headers.put("Sec-Ch-Ua", "\"Chromium\";v=\"%d\", \"Google Chrome\";v=\"%d\", \"Not_A Brand\";v=\"99\""
				.formatted(major, major));
		return headers;
	}

	private String userAgent(int major) {
		String platform = random.nextBoolean()
				? "Windows NT 10.0; Win64; x64"
				: "Macintosh; Intel Mac OS X %d_%d_%d".formatted(13 + random.nextInt(3), random.nextInt(10), random.nextInt(10));
		return "Mozilla/5.0 (%s) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/%d.0.%d.%d Safari/537.36"
				.formatted(platform, major, random.nextInt(10), random.nextInt(1000));
	}
}
