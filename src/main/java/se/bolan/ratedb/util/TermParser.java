package se.bolan.ratedb.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import se.bolan.ratedb.model.Term;

/**
 * Maps the many spellings of a binding period to a {@link Term}. Understands Swedish ("3 mån", "36
 * månaders", "1 år"), English ("3 months", "1yr"), enum style identifiers ("threeMonth",
 * "ONE_YEAR", "P_10_YEARS") and compact codes ("3M", "10y").
 */
public class TermParser {
	private static final Map<String, Integer> NUMBER_WORDS = Map.of(
			"one", 1, "two", 2, "three", 3, "four", 4, "five", 5, "six", 6, "seven", 7, "eight", 8, "nine", 9,
			"ten", 10);

	// Longer units first so "månaders" is not cut short at "mån". The count must not be the fraction
	// of a decimal number such as "2,5 år".
	private static final Pattern TERM = Pattern.compile(
			"(?<![a-zåäö\\d])(?<!\\d[.,])(\\d{1,3}|one|two|three|four|five|six|seven|eight|nine|ten)\\s*"
					+ "(månaders|månader|månad|mån|months|month|mon|mo|m|years|year|yrs|yr|y|års|år)"
					+ "(?![a-zåäö])");

	private static final List<String> ALWAYS_HEADER = List.of("genomsnitt", "bindningstid");
	private static final List<String> LABEL_WORDS =
			List.of("månad", "period", "datum", "löptid", "ränta", "tid", "term", "date");
	private static final Pattern DIGIT = Pattern.compile("\\d");

	private TermParser() {}

	/**
	 * Parse a term.
	 *
	 * @throws TermHeaderException if the text is a header label such as "Bindningstid" or "Månad"
	 * @throws ValueParseException if the text is not a supported term
	 */
	public static Term parse(String text) throws ValueParseException {
		String s = TextUtils.normalizeSpaces(text).toLowerCase(Locale.ROOT);
		s = s.replace('_', ' ').replace('-', ' ').replace("*", "").trim();

		if (isHeader(s)) {
			throw new TermHeaderException(text);
		}

		Matcher m = TERM.matcher(s);
		if (!m.find()) {
			throw new ValueParseException("Unsupported term: '" + text + "'");
		}
		int count = NUMBER_WORDS.containsKey(m.group(1)) ? NUMBER_WORDS.get(m.group(1)) : Integer.parseInt(m.group(1));
		int months = isYearUnit(m.group(2)) ? count * 12 : count;
		Term term = Term.ofMonths(months);
		if (term == null) {
			throw new ValueParseException("Unsupported term length: '" + text + "'");
		}
		return term;
	}

	/** Parse a term, or empty if the text is a header or not a supported term */
	public static Optional<Term> tryParse(String text) {
		try {
			return Optional.of(parse(text));
		} catch (ValueParseException e) {
			return Optional.empty();
		}
	}

	/**
	 * Interpret a term given as a period basis and a count. Basis "3" counts months and basis "4"
	 * counts years.
	 */
	public static Term fromPeriodBasis(String basisType, int count) throws ValueParseException {
		if (basisType == null) {
			throw new ValueParseException("Missing period basis");
		}
		int months;
		switch (basisType) {
			case "3" -> months = count;
			case "4" -> months = count * 12;
			default -> throw new ValueParseException("Unsupported period basis: " + basisType);
		}
		Term term = Term.ofMonths(months);
		if (term == null) {
			throw new ValueParseException("Unsupported term: " + count + " (basis " + basisType + ")");
		}
		return term;
	}

	/** Returns true if the text is a header label rather than a term */
	public static boolean isHeader(String text) {
		String s = TextUtils.normalizeSpaces(text).toLowerCase(Locale.ROOT);
		if (s.equals("tot")) {
			return true;
		}
		for (String word : ALWAYS_HEADER) {
			if (s.contains(word)) {
				return true;
			}
		}
		if (DIGIT.matcher(s).find()) {
			return false;
		}
		for (String word : LABEL_WORDS) {
			if (s.contains(word)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isYearUnit(String unit) {
		return unit.startsWith("y") || unit.startsWith("å");
	}
}
