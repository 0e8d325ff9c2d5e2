package se.bolan.ratedb.util;

import java.util.Locale;
import java.util.Map;

/** Swedish month names and their common abbreviations */
public class SwedishMonths {
	private static final Map<String, Integer> MONTHS = Map.ofEntries(
			Map.entry("januari", 1),
			Map.entry("jan", 1),
			Map.entry("februari", 2),
			Map.entry("feb", 2),
			Map.entry("mars", 3),
			Map.entry("mar", 3),
			Map.entry("april", 4),
			Map.entry("apr", 4),
			Map.entry("maj", 5),
			Map.entry("juni", 6),
			Map.entry("jun", 6),
			Map.entry("juli", 7),
			Map.entry("jul", 7),
			Map.entry("augusti", 8),
			Map.entry("aug", 8),
			Map.entry("september", 9),
			Map.entry("sept", 9),
			Map.entry("sep", 9),
			Map.entry("oktober", 10),
			Map.entry("okt", 10),
			Map.entry("november", 11),
			Map.entry("nov", 11),
			Map.entry("december", 12),
			Map.entry("dec", 12));

	private SwedishMonths() {}

	/**
	 * Look up a month by its Swedish name or abbreviation, ignoring case and a trailing period.
	 *
	 * @return the month number 1-12, or 0 if the name is unknown
	 */
	public static int lookup(String name) {
		if (name == null) {
			return 0;
		}
		String key = TextUtils.normalizeSpaces(name).toLowerCase(Locale.ROOT);
		if (key.endsWith(".")) {
			key = key.substring(0, key.length() - 1);
		}
		return MONTHS.getOrDefault(key, 0);
	}

	/** Regex alternation matching every known month name, longest names first */
	public static String pattern() {
		return "januari|februari|mars|april|maj|juni|juli|augusti|september|oktober|november|december"
				+ "|sept|jan|feb|mar|apr|jun|jul|aug|sep|okt|nov|dec";
	}
}
