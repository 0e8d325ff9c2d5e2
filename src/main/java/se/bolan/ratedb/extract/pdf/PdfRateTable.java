package se.bolan.ratedb.extract.pdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import se.bolan.ratedb.model.AvgMonth;
import se.bolan.ratedb.model.Term;
import se.bolan.ratedb.util.DateParsers;
import se.bolan.ratedb.util.SwedishMonths;
import se.bolan.ratedb.util.TermParser;
import se.bolan.ratedb.util.TextUtils;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Reads a table of average rates from the flat text of a PDF. Term columns come from the header,
 * then every period anchor is followed by its rates in column order.
 */
public class PdfRateTable {
	private static final Pattern HEADER_TERM =
			Pattern.compile("(\\d+)\\s*(månaders|månader|mån|år)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
	private static final Pattern RATE = Pattern.compile("\\d+[,.]\\d+");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	/** How the start of each table row is recognized */
	public enum Anchor {
		/** {@code 20251031} */
		DATE_YYYYMMDD(Pattern.compile("(?<!\\d)(20\\d{6})(?!\\d)")),
		/** {@code oktober 2025}, whitespace between month and year is optional */
		MONTH_NAME_YEAR(Pattern.compile(
				"(?<!\\p{L})((?:" + SwedishMonths.pattern() + ")\\.?\\s*(?:19|20)\\d{2})",
				Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));

		private final Pattern pattern;

		Anchor(Pattern pattern) {
			this.pattern = pattern;
		}

		Optional<AvgMonth> parse(String token) {
			try {
				return Optional.of(
						this == DATE_YYYYMMDD ? DateParsers.yyyymmdd(token) : DateParsers.monthNameYear(token));
			} catch (ValueParseException e) {
				return Optional.empty();
			}
		}
	}

	/** Rates of one period in column order; a null entry means the column has no data */
	public record PeriodRates(AvgMonth month, List<Double> rates) {}

	private PdfRateTable() {}

	/**
	 * Find the term columns in the header, in order and without duplicates. When the text contains
	 * "Bindningstid" only what follows it is searched.
	 */
	public static List<Term> headerTerms(String text) {
		String region = text;
		int start = text.toLowerCase(Locale.ROOT).indexOf("bindningstid");
		if (start >= 0) {
			region = text.substring(start);
		}
		Set<Term> terms = new LinkedHashSet<>();
		Matcher m = HEADER_TERM.matcher(region);
		while (m.find()) {
			String unit = m.group(2).toLowerCase(Locale.ROOT).replace("månaders", "mån").replace("månader", "mån");
			TermParser.tryParse(m.group(1) + " " + unit).ifPresent(terms::add);
		}
		return new ArrayList<>(terms);
	}

	/**
	 * Split the text into periods and collect up to {@code columns} values for each. Numbers become
	 * rates, dashes become empty columns and any other text is ignored.
	 */
	public static List<PeriodRates> parse(String text, int columns, Anchor anchor) {
		List<int[]> spans = new ArrayList<>();
		List<AvgMonth> months = new ArrayList<>();
		Matcher m = anchor.pattern.matcher(text);
		while (m.find()) {
			// Anything that looks like a period but is not a valid month stays plain text
			Optional<AvgMonth> month = anchor.parse(m.group(1));
			if (month.isPresent()) {
				months.add(month.get());
				spans.add(new int[] {m.start(), m.end()});
			}
		}

		List<PeriodRates> result = new ArrayList<>();
		for (int i = 0; i < spans.size(); i++) {
			int from = spans.get(i)[1];
			int to = i + 1 < spans.size() ? spans.get(i + 1)[0] : text.length();
			List<Double> rates = values(text.substring(from, to), columns);
			if (rates.stream().anyMatch(r -> r != null)) {
				result.add(new PeriodRates(months.get(i), Collections.unmodifiableList(rates)));
			}
		}
		return result;
	}

	private static List<Double> values(String segment, int columns) {
		List<Double> values = new ArrayList<>();
		for (String token : WHITESPACE.split(segment.trim())) {
			if (values.size() >= columns) {
				break;
			}
			if (token.isEmpty()) {
				continue;
			}
			if (TextUtils.isPlaceholder(token)) {
				values.add(null);
				continue;
			}
			Matcher rate = RATE.matcher(token);
			while (rate.find() && values.size() < columns) {
				double value = Double.parseDouble(rate.group().replace(',', '.'));
				values.add(value > 0 ? value : null);
			}
		}
		return values;
	}
}
