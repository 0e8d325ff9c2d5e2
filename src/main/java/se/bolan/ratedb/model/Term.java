package se.bolan.ratedb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Fixed binding periods a published rate can refer to */
public enum Term {
	THREE_MONTHS("3m", 3),
	SIX_MONTHS("6m", 6),
	ONE_YEAR("1y", 12),
	TWO_YEARS("2y", 24),
	THREE_YEARS("3y", 36),
	FOUR_YEARS("4y", 48),
	FIVE_YEARS("5y", 60),
	SIX_YEARS("6y", 72),
	SEVEN_YEARS("7y", 84),
	EIGHT_YEARS("8y", 96),
	NINE_YEARS("9y", 108),
	TEN_YEARS("10y", 120);

	private final String code;
	private final int months;

	Term(String code, int months) {
		this.code = code;
		this.months = months;
	}

	@JsonValue
	public String code() {
		return code;
	}

	public int months() {
		return months;
	}

	/** Look up a term by its binding period in months, or null if there is none */
	public static Term ofMonths(int months) {
		for (Term term : values()) {
			if (term.months == months) {
				return term;
			}
		}
		return null;
	}

	@JsonCreator
	public static Term ofCode(String code) {
		for (Term term : values()) {
			if (term.code.equals(code)) {
				return term;
			}
		}
		throw new IllegalArgumentException("Unknown term code: " + code);
	}

	@Override
	public String toString() {
		return code;
	}
}
