package se.bolan.ratedb.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.YearMonth;

/** A calendar month that an average rate describes */
@JsonPropertyOrder({"year", "month"})
public record AvgMonth(@JsonProperty("year") int year, @JsonProperty("month") int month)
		implements Comparable<AvgMonth> {

	public static final int MIN_YEAR = 1940;
	public static final int MAX_YEAR = 2100;

	public AvgMonth {
		if (month < 1 || month > 12) {
			throw new IllegalArgumentException("Month out of range: " + month);
		}
		if (year < MIN_YEAR || year > MAX_YEAR) {
			throw new IllegalArgumentException("Year out of range: " + year);
		}
	}

	public static AvgMonth of(YearMonth yearMonth) {
		return new AvgMonth(yearMonth.getYear(), yearMonth.getMonthValue());
	}

	public YearMonth toYearMonth() {
		return YearMonth.of(year, month);
	}

	@Override
	public int compareTo(AvgMonth other) {
		return year != other.year ? Integer.compare(year, other.year) : Integer.compare(month, other.month);
	}

	@Override
	public String toString() {
		return "%04d-%02d".formatted(year, month);
	}
}
