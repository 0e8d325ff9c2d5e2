package se.bolan.ratedb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One observed mortgage rate. Instances are immutable and can only be created through {@link
 * Builder}, which rejects non-positive rates and optional fields that do not belong to the rate
 * type.
 */
@JsonPropertyOrder({
	"bank",
	"type",
	"term",
	"nominal_rate",
	"changed_on",
	"last_crawled_at",
	"average_reference_month",
	"ratio_discount_boundaries",
	"union_discount"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = InterestSet.Builder.class)
public final class InterestSet {
	private final String bank;
	private final RateType type;
	private final Term term;
	private final double nominalRate;
	private final LocalDate changedOn;
	private final Instant lastCrawledAt;
	private final AvgMonth averageReferenceMonth;
	private final RatioDiscountBoundary ratioDiscountBoundaries;
	private final boolean unionDiscount;

	private InterestSet(Builder builder) {
		this.bank = builder.bank;
		this.type = builder.type;
		this.term = builder.term;
		this.nominalRate = builder.nominalRate;
		this.changedOn = builder.changedOn;
		this.lastCrawledAt = builder.lastCrawledAt;
		this.averageReferenceMonth = builder.averageReferenceMonth;
		this.ratioDiscountBoundaries = builder.ratioDiscountBoundaries;
		this.unionDiscount = builder.unionDiscount;
	}

	public static Builder builder() {
		return new Builder();
	}

	/** Start a list rate record */
	public static Builder listRate(String bank, Term term, double nominalRate) {
		return builder().bank(bank).type(RateType.LIST_RATE).term(term).nominalRate(nominalRate);
	}

	/** Start an average rate record for the given month */
	public static Builder averageRate(String bank, Term term, double nominalRate, AvgMonth month) {
		return builder()
				.bank(bank)
				.type(RateType.AVERAGE_RATE)
				.term(term)
				.nominalRate(nominalRate)
				.averageReferenceMonth(month);
	}

	@JsonProperty("bank")
	public String bank() {
		return bank;
	}

	@JsonProperty("type")
	public RateType type() {
		return type;
	}

	@JsonProperty("term")
	public Term term() {
		return term;
	}

	@JsonProperty("nominal_rate")
	public double nominalRate() {
		return nominalRate;
	}

	@JsonIgnore
	public LocalDate changedOn() {
		return changedOn;
	}

	@JsonProperty("changed_on")
	private String changedOnText() {
		return changedOn != null ? changedOn.toString() : null;
	}

	@JsonIgnore
	public Instant lastCrawledAt() {
		return lastCrawledAt;
	}

	@JsonProperty("last_crawled_at")
	private String lastCrawledAtText() {
		return lastCrawledAt.toString();
	}

	@JsonProperty("average_reference_month")
	public AvgMonth averageReferenceMonth() {
		return averageReferenceMonth;
	}

	@JsonProperty("ratio_discount_boundaries")
	public RatioDiscountBoundary ratioDiscountBoundaries() {
		return ratioDiscountBoundaries;
	}

	@JsonProperty("union_discount")
	public boolean unionDiscount() {
		return unionDiscount;
	}

	/** Identity used for idempotent upserts */
	@JsonIgnore
	public Key naturalKey() {
		return new Key(
				bank,
				type,
				term,
				type == RateType.LIST_RATE ? changedOn : null,
				averageReferenceMonth,
				ratioDiscountBoundaries);
	}

	/** Natural key of a record: bank, type, term and whichever dated or bracketed field applies */
	public record Key(
			String bank,
			RateType type,
			Term term,
			LocalDate changedOn,
			AvgMonth averageReferenceMonth,
			RatioDiscountBoundary ratioDiscountBoundaries) {}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof InterestSet)) return false;
		InterestSet that = (InterestSet) o;
		return Double.compare(that.nominalRate, nominalRate) == 0
				&& unionDiscount == that.unionDiscount
				&& Objects.equals(bank, that.bank)
				&& type == that.type
				&& term == that.term
				&& Objects.equals(changedOn, that.changedOn)
				&& Objects.equals(lastCrawledAt, that.lastCrawledAt)
				&& Objects.equals(averageReferenceMonth, that.averageReferenceMonth)
				&& Objects.equals(ratioDiscountBoundaries, that.ratioDiscountBoundaries);
	}

	@Override
	public int hashCode() {
		return Objects.hash(
				bank,
				type,
				term,
				nominalRate,
				changedOn,
				lastCrawledAt,
				averageReferenceMonth,
				ratioDiscountBoundaries,
				unionDiscount);
	}

	@Override
	public String toString() {
		var sb = new StringBuilder();
		sb.append(bank).append(' ').append(type).append(' ').append(term).append(' ').append(nominalRate);
		if (changedOn != null) {
			sb.append(" changed ").append(changedOn);
		}
		if (averageReferenceMonth != null) {
			sb.append(" for ").append(averageReferenceMonth);
		}
		if (ratioDiscountBoundaries != null) {
			sb.append(" ltv ")
					.append(ratioDiscountBoundaries.minRatio())
					.append('-')
					.append(ratioDiscountBoundaries.maxRatio());
		}
		if (unionDiscount) {
			sb.append(" union");
		}
		return sb.toString();
	}

	/** Builder for {@link InterestSet}, also used by Jackson when reading stored records */
	@JsonPOJOBuilder(withPrefix = "")
	public static final class Builder {
		private String bank;
		private RateType type;
		private Term term;
		private double nominalRate;
		private LocalDate changedOn;
		private Instant lastCrawledAt;
		private AvgMonth averageReferenceMonth;
		private RatioDiscountBoundary ratioDiscountBoundaries;
		private boolean unionDiscount;

		private Builder() {}

		@JsonProperty("bank")
		public Builder bank(String bank) {
			this.bank = bank;
			return this;
		}

		@JsonProperty("type")
		public Builder type(RateType type) {
			this.type = type;
			return this;
		}

		@JsonProperty("term")
		public Builder term(Term term) {
			this.term = term;
			return this;
		}

		@JsonProperty("nominal_rate")
		public Builder nominalRate(double nominalRate) {
			this.nominalRate = nominalRate;
			return this;
		}

		@JsonIgnore
		public Builder changedOn(LocalDate changedOn) {
			this.changedOn = changedOn;
			return this;
		}

		@JsonProperty("changed_on")
		private Builder changedOnText(String changedOn) {
			this.changedOn = changedOn != null ? LocalDate.parse(changedOn) : null;
			return this;
		}

		@JsonIgnore
		public Builder lastCrawledAt(Instant lastCrawledAt) {
			this.lastCrawledAt = lastCrawledAt;
			return this;
		}

		@JsonProperty("last_crawled_at")
		private Builder lastCrawledAtText(String lastCrawledAt) {
			this.lastCrawledAt = lastCrawledAt != null ? Instant.parse(lastCrawledAt) : null;
			return this;
		}

		@JsonProperty("average_reference_month")
		public Builder averageReferenceMonth(AvgMonth averageReferenceMonth) {
			this.averageReferenceMonth = averageReferenceMonth;
			return this;
		}

		@JsonProperty("ratio_discount_boundaries")
		public Builder ratioDiscountBoundaries(RatioDiscountBoundary ratioDiscountBoundaries) {
			this.ratioDiscountBoundaries = ratioDiscountBoundaries;
			return this;
		}

		@JsonProperty("union_discount")
		public Builder unionDiscount(boolean unionDiscount) {
			this.unionDiscount = unionDiscount;
			return this;
		}

		/**
		 * Validate and create the record.
		 *
		 * @throws IllegalStateException if a required field is missing, the rate is not positive or an
		 *     optional field does not belong to the rate type
		 */
		public InterestSet build() {
			if (bank == null || bank.isBlank()) {
				throw new IllegalStateException("Bank is required");
			}
			if (type == null) {
				throw new IllegalStateException("Type is required");
			}
			if (term == null) {
				throw new IllegalStateException("Term is required");
			}
			if (lastCrawledAt == null) {
				throw new IllegalStateException("Crawl time is required");
			}
			if (!Double.isFinite(nominalRate) || nominalRate <= 0) {
				throw new IllegalStateException("Nominal rate must be positive, was " + nominalRate);
			}
			if (changedOn != null && type != RateType.LIST_RATE) {
				throw new IllegalStateException("Change date only applies to list rates, not " + type);
			}
			if ((averageReferenceMonth != null) != (type == RateType.AVERAGE_RATE)) {
				throw new IllegalStateException("Reference month is required for, and only for, average rates");
			}
			if ((ratioDiscountBoundaries != null) != (type == RateType.RATIO_DISCOUNTED_RATE)) {
				throw new IllegalStateException(
						"Ratio boundaries are required for, and only for, ratio discounted rates");
			}
			if (unionDiscount && type != RateType.UNION_DISCOUNTED_RATE) {
				throw new IllegalStateException("Union discount only applies to union discounted rates");
			}
			return new InterestSet(this);
		}
	}
}
