package se.bolan.ratedb.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Loan-to-value bracket a discounted rate applies to, as fractions between 0 and 1 */
@JsonPropertyOrder({"min_ratio", "max_ratio"})
public record RatioDiscountBoundary(
		@JsonProperty("min_ratio") double minRatio, @JsonProperty("max_ratio") double maxRatio) {

	public RatioDiscountBoundary {
		if (minRatio < 0 || maxRatio > 1 || minRatio > maxRatio) {
			throw new IllegalArgumentException("Invalid ratio bracket: " + minRatio + " - " + maxRatio);
		}
	}
}
