package se.bolan.ratedb.crawler;

import java.io.IOException;
import java.util.Map;

/** Retrieves documents for crawlers. Implementations must be safe to share between threads. */
public interface Fetcher {

	/**
	 * Fetch a text document, decoded as UTF-8.
	 *
	 * @param url The address to fetch
	 * @param headers Request headers, overriding any defaults of the same name
	 */
	String fetch(String url, Map<String, String> headers) throws IOException, InterruptedException;

	/** Fetch a binary document such as a PDF or a spreadsheet */
	byte[] fetchRaw(String url, Map<String, String> headers) throws IOException, InterruptedException;

	default String fetch(String url) throws IOException, InterruptedException {
		return fetch(url, Map.of());
	}

	default byte[] fetchRaw(String url) throws IOException, InterruptedException {
		return fetchRaw(url, Map.of());
	}
}
