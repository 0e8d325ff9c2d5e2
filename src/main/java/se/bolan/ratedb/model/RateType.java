package se.bolan.ratedb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of rate observation */
public enum RateType {
	LIST_RATE("listRate"),
	AVERAGE_RATE("averageRate"),
	RATIO_DISCOUNTED_RATE("ratioDiscountedRate"),
	UNION_DISCOUNTED_RATE("unionDiscountedRate");

	private final String code;

	RateType(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}

	@JsonCreator
	public static RateType ofCode(String code) {
		for (RateType type : values()) {
			if (type.code.equals(code)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown rate type: " + code);
	}

	@Override
	public String toString() {
		return code;
	}
}
