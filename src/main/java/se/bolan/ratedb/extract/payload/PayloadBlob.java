package se.bolan.ratedb.extract.payload;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import se.bolan.ratedb.extract.NotFoundException;

/** Cuts embedded application state out of an HTML page */
public class PayloadBlob {
	/** Next.js page props */
	public static final Pattern NEXT_DATA =
			Pattern.compile("<script id=\"__NEXT_DATA__\" type=\"application/json\"[^>]*>(.+?)</script>", Pattern.DOTALL);

	private PayloadBlob() {}

	/**
	 * Return the first capture group of the pattern.
	 *
	 * @throws NotFoundException if the pattern does not match or captures nothing
	 */
	public static String extract(String document, Pattern pattern) throws NotFoundException {
		Matcher m = pattern.matcher(document);
		if (!m.find() || m.groupCount() < 1 || m.group(1) == null || m.group(1).isBlank()) {
			throw new NotFoundException("Failed to find embedded data matching " + pattern.pattern());
		}
		return m.group(1);
	}

	/** The JSON of a Next.js {@code __NEXT_DATA__} script tag */
	public static String nextData(String document) throws NotFoundException {
		return extract(document, NEXT_DATA);
	}
}
