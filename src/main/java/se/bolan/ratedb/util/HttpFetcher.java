package se.bolan.ratedb.util;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.bolan.ratedb.crawler.Fetcher;

/** {@link Fetcher} backed by the JDK HTTP client */
public class HttpFetcher implements Fetcher {
	private static final Logger logger = LoggerFactory.getLogger(HttpFetcher.class);

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);

	private final HttpClient httpClient;
	private final Duration timeout;
	private final int maxRetries;
	private final BrowserHeaders browserHeaders;

	public HttpFetcher() {
		this(DEFAULT_TIMEOUT, 0);
	}

	/**
	 * @param timeout Connect and request timeout
	 * @param maxRetries How many times a failed request is repeated, 0 to never retry
	 */
	public HttpFetcher(Duration timeout, int maxRetries) {
		// Redirects are not followed, a moved page is reported as a failure
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NEVER)
				.connectTimeout(timeout)
				.build();
		this.timeout = timeout;
		this.maxRetries = Math.max(0, maxRetries);
		this.browserHeaders = new BrowserHeaders();
	}

	@Override
	public String fetch(String url, Map<String, String> headers) throws IOException, InterruptedException {
		return retry(url, () -> {
			HttpResponse<byte[]> response = httpClient.send(request(url, headers), HttpResponse.BodyHandlers.ofByteArray());
			checkStatus(url, response);
			return new String(response.body(), StandardCharsets.UTF_8);
		});
	}

	@Override
	public byte[] fetchRaw(String url, Map<String, String> headers) throws IOException, InterruptedException {
		return retry(url, () -> {
			HttpResponse<byte[]> response = httpClient.send(request(url, headers), HttpResponse.BodyHandlers.ofByteArray());
			checkStatus(url, response);
			return response.body();
		});
	}

	private HttpRequest request(String url, Map<String, String> headers) throws IOException {
		URI uri;
		try {
			uri = URI.create(url);
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid URL: " + url, e);
		}
		HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri).timeout(timeout).GET();
		var merged = browserHeaders.create();
		merged.putAll(headers);
		merged.forEach(builder::setHeader);
		return builder.build();
	}

	private static void checkStatus(String url, HttpResponse<?> response) throws IOException {
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new IOException("Failed to fetch " + url + " - HTTP status: " + response.statusCode());
		}
	}

	/** Run the operation, repeating it with exponential backoff while it fails and retries remain */
	private <T> T retry(String url, IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			try {
				return operation.get();
			} catch (IOException e) {
				lastException = e;
				if (attempt < maxRetries) {
					// Exponential backoff: 2s, 4s, 8s, ...
					long backoffMillis = INITIAL_BACKOFF.toMillis() * (1L << attempt);
					logger.debug("Retrying {} in {} ms: {}", url, backoffMillis, e.getMessage());
					Thread.sleep(backoffMillis);
				}
			}
		}
		throw lastException;
	}
}
