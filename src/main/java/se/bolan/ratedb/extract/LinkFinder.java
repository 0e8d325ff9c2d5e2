package se.bolan.ratedb.extract;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jsoup.Jsoup;

/** Finds links to downloadable documents, such as PDF reports, in an HTML page */
public class LinkFinder {

	private LinkFinder() {}

	/**
	 * All absolute link targets of the page ending with the given extension, in document order.
	 * Relative links are resolved against {@code baseUrl}.
	 */
	public static List<String> links(String html, String baseUrl, String extension) {
		String suffix = extension.toLowerCase(Locale.ROOT);
		return Jsoup.parse(html, baseUrl).select("a[href]").stream()
				.map(a -> a.absUrl("href"))
				.filter(url -> !url.isEmpty())
				.filter(url -> stripQuery(url).toLowerCase(Locale.ROOT).endsWith(suffix))
				.distinct()
				.toList();
	}

	/**
	 * The first link whose target contains one of the preferred keywords, or else the first link with
	 * the extension.
	 */
	public static Optional<String> find(String html, String baseUrl, String extension, List<String> preferred) {
		List<String> links = links(html, baseUrl, extension);
		return links.stream()
				.filter(url -> preferred.stream()
						.anyMatch(k -> url.toLowerCase(Locale.ROOT).contains(k.toLowerCase(Locale.ROOT))))
				.findFirst()
				.or(() -> links.stream().findFirst());
	}

	private static String stripQuery(String url) {
		int end = url.length();
		for (char c : new char[] {'?', '#'}) {
			int i = url.indexOf(c);
			if (i >= 0 && i < end) {
				end = i;
			}
		}
		return url.substring(0, end);
	}
}
