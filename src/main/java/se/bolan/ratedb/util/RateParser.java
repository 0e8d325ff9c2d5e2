package se.bolan.ratedb.util;

import java.util.regex.Pattern;

/** Parses published percentages such as {@code "3,33 %"} or {@code "3.33%"} */
public class RateParser {
	private static final Pattern RATE = Pattern.compile("^\\d+(\\.\\d+)?$");

	private RateParser() {}

	/**
	 * Parse a nominal rate in percent.
	 *
	 * @throws ValueParseException for blanks, dash placeholders and anything that is not a positive
	 *     decimal number
	 */
	public static double parse(String text) throws ValueParseException {
		String s = TextUtils.normalizeSpaces(text);
		if (TextUtils.isPlaceholder(s)) {
			throw new ValueParseException("No rate published: '" + s + "'");
		}
		s = s.replace("*", "").trim();
		while (s.endsWith("%")) {
			s = s.substring(0, s.length() - 1).trim();
		}
		s = s.replace(" ", "").replace(',', '.');
		if (!RATE.matcher(s).matches()) {
			throw new ValueParseException("Unsupported rate: '" + text + "'");
		}
		double rate = Double.parseDouble(s);
		if (rate <= 0) {
			throw new ValueParseException("Rate must be positive: '" + text + "'");
		}
		return rate;
	}
}
