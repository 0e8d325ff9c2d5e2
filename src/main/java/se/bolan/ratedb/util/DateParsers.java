package se.bolan.ratedb.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import se.bolan.ratedb.model.AvgMonth;

/**
 * Parsers for the date and month notations used by Swedish banks. Every parser rejects months
 * outside 1-12 and years outside {@value AvgMonth#MIN_YEAR}-{@value AvgMonth#MAX_YEAR}.
 */
public class DateParsers {
	private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})$");
	private static final Pattern DOTTED_DATE = Pattern.compile("^(\\d{4})\\.(\\d{2})\\.(\\d{2})$");
	private static final Pattern DAY_MONTH_NAME_YEAR =
			Pattern.compile("^(\\d{1,2})\\s+(\\p{L}+\\.?)\\s+(\\d{4})$");
	private static final Pattern YEAR_MONTH_DASHED = Pattern.compile("^(\\d{4})-(\\d{1,2})$");
	private static final Pattern YEAR_MONTH_COMPACT = Pattern.compile("^(\\d{4})(\\d{2})$");
	private static final Pattern YEAR_SPACE_MONTH = Pattern.compile("^(\\d{4})\\s+(\\d{1,2})$");
	private static final Pattern MONTH_NAME_YEAR = Pattern.compile("^(\\p{L}+)\\.?\\s*(\\d{4})$");
	private static final Pattern YEAR_MONTH_NAME = Pattern.compile("^(\\d{4})\\s*(\\p{L}+)\\.?$");
	private static final Pattern YYYYMMDD = Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})$");
	private static final Pattern US_SHORT_DATE = Pattern.compile("^(\\d{1,2})-(\\d{1,2})-(\\d{2})$");

	private DateParsers() {}

	/** {@code 2025-10-01} */
	public static LocalDate isoDate(String text) throws ValueParseException {
		Matcher m = match(ISO_DATE, text);
		return date(text, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
	}

	/** {@code 2025-11-10T00:00:00.000Z}, reduced to its calendar date */
	public static LocalDate isoDateTime(String text) throws ValueParseException {
		String s = TextUtils.normalizeSpaces(text);
		try {
			LocalDate date = OffsetDateTime.parse(s).toLocalDate();
			checkYear(text, date.getYear());
			return date;
		} catch (DateTimeParseException e) {
			throw new ValueParseException("Unsupported timestamp: '" + text + "'", e);
		}
	}

	/** {@code 2025.10.01} */
	public static LocalDate dottedDate(String text) throws ValueParseException {
		Matcher m = match(DOTTED_DATE, text);
		return date(text, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
	}

	/** {@code 1 oktober 2025} or {@code 25 sep. 2025} */
	public static LocalDate dayMonthNameYear(String text) throws ValueParseException {
		Matcher m = match(DAY_MONTH_NAME_YEAR, text);
		int month = monthName(text, m.group(2));
		return date(text, Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(1)));
	}

	/** {@code 10-31-25}, month first with a two digit year (90 and above are 1900s) */
	public static LocalDate monthDayShortYear(String text) throws ValueParseException {
		Matcher m = match(US_SHORT_DATE, text);
		int yy = Integer.parseInt(m.group(3));
		int year = yy >= 90 ? 1900 + yy : 2000 + yy;
		return date(text, year, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
	}

	/** {@code 2025-10} */
	public static AvgMonth yearMonthDashed(String text) throws ValueParseException {
		Matcher m = match(YEAR_MONTH_DASHED, text);
		return month(text, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
	}

	/** {@code 202510} */
	public static AvgMonth yearMonthCompact(String text) throws ValueParseException {
		Matcher m = match(YEAR_MONTH_COMPACT, text);
		return month(text, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
	}

	/** {@code 202510} given as a number */
	public static AvgMonth yearMonthCompact(int value) throws ValueParseException {
		return yearMonthCompact(Integer.toString(value));
	}

	/**
	 * A two digit year followed by a two digit month, e.g. {@code 2510}. Years below 40 are in the
	 * 2000s, the rest in the 1900s.
	 */
	public static AvgMonth yymm(int value) throws ValueParseException {
		if (value < 0 || value > 9999) {
			throw new ValueParseException("Unsupported YYMM value: " + value);
		}
		int yy = value / 100;
		int month = value % 100;
		int year = yy < 40 ? 2000 + yy : 1900 + yy;
		return month(Integer.toString(value), year, month);
	}

	/** {@code 2025 10} */
	public static AvgMonth yearSpaceMonth(String text) throws ValueParseException {
		Matcher m = match(YEAR_SPACE_MONTH, text);
		return month(text, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
	}

	/** {@code november 2025}, {@code nov. 2025} or {@code Okt 2025} */
	public static AvgMonth monthNameYear(String text) throws ValueParseException {
		Matcher m = match(MONTH_NAME_YEAR, text);
		return month(text, Integer.parseInt(m.group(2)), monthName(text, m.group(1)));
	}

	/** {@code 2025 november} or {@code 2025 nov.} */
	public static AvgMonth yearMonthName(String text) throws ValueParseException {
		Matcher m = match(YEAR_MONTH_NAME, text);
		return month(text, Integer.parseInt(m.group(1)), monthName(text, m.group(2)));
	}

	/** {@code 20251031}, reduced to the month it falls in */
	public static AvgMonth yyyymmdd(String text) throws ValueParseException {
		Matcher m = match(YYYYMMDD, text);
		LocalDate date =
				date(text, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
		return AvgMonth.of(YearMonth.from(date));
	}

	private static Matcher match(Pattern pattern, String text) throws ValueParseException {
		Matcher m = pattern.matcher(TextUtils.normalizeSpaces(text));
		if (!m.matches()) {
			throw new ValueParseException("Unsupported date format: '" + text + "'");
		}
		return m;
	}

	private static int monthName(String text, String name) throws ValueParseException {
		int month = SwedishMonths.lookup(name);
		if (month == 0) {
			throw new ValueParseException("Unknown month name '" + name + "' in '" + text + "'");
		}
		return month;
	}

	private static AvgMonth month(String text, int year, int month) throws ValueParseException {
		if (month < 1 || month > 12) {
			throw new ValueParseException("Month out of range in '" + text + "'");
		}
		checkYear(text, year);
		return new AvgMonth(year, month);
	}

	private static LocalDate date(String text, int year, int month, int day) throws ValueParseException {
		if (month < 1 || month > 12) {
			throw new ValueParseException("Month out of range in '" + text + "'");
		}
		checkYear(text, year);
		try {
			return LocalDate.of(year, month, day);
		} catch (DateTimeException e) {
			throw new ValueParseException("Invalid date '" + text + "'", e);
		}
	}

	private static void checkYear(String text, int year) throws ValueParseException {
		if (year < AvgMonth.MIN_YEAR || year > AvgMonth.MAX_YEAR) {
			throw new ValueParseException("Year out of range in '" + text + "'");
		}
	}
}
