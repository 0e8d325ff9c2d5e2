package se.bolan.ratedb.util;

import java.util.regex.Pattern;

/** Utility methods for cleaning up scraped text */
public class TextUtils {
	private static final Pattern SPECIAL_SPACES =
			Pattern.compile("&nbsp;|[\\u00A0\\u0085\\u2009\\u200A\\u200B\\u200C\\u200D\\uFEFF\\u202F\\t\\n\\r\\u000B\\f]");
	private static final Pattern MULTIPLE_SPACES = Pattern.compile(" {2,}");

	private TextUtils() {}

	/**
	 * Replace non-breaking, zero-width and control whitespace with plain spaces, collapse runs of
	 * spaces and trim the result.
	 */
	public static String normalizeSpaces(String text) {
		if (text == null) {
			return "";
		}
		String result = SPECIAL_SPACES.matcher(text).replaceAll(" ");
		result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
		return result.trim();
	}

	/** True for the markers publishers use when a value is not available */
	public static boolean isPlaceholder(String text) {
		String s = normalizeSpaces(text);
		return s.isEmpty() || s.equals("-") || s.equals("–") || s.equals("—") || s.equalsIgnoreCase("n/a");
	}
}
