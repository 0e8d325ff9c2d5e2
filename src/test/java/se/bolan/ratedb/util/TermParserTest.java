package se.bolan.ratedb.util;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import se.bolan.ratedb.model.Term;

class TermParserTest {

	@Test
	void testSwedishTerms() throws Exception {
		assertThat(TermParser.parse("3 mån")).isEqualTo(Term.THREE_MONTHS);
		assertThat(TermParser.parse("3 månader")).isEqualTo(Term.THREE_MONTHS);
		assertThat(TermParser.parse("36 månaders")).isEqualTo(Term.THREE_YEARS);
		assertThat(TermParser.parse("1 år")).isEqualTo(Term.ONE_YEAR);
		assertThat(TermParser.parse("10 år")).isEqualTo(Term.TEN_YEARS);
		assertThat(TermParser.parse("6 mån")).isEqualTo(Term.SIX_MONTHS);
	}

	@Test
	void testEnglishAndCodeTerms() throws Exception {
		assertThat(TermParser.parse("3 months")).isEqualTo(Term.THREE_MONTHS);
		assertThat(TermParser.parse("1yr")).isEqualTo(Term.ONE_YEAR);
		assertThat(TermParser.parse("3M")).isEqualTo(Term.THREE_MONTHS);
		assertThat(TermParser.parse("10Y")).isEqualTo(Term.TEN_YEARS);
		assertThat(TermParser.parse("threeMonth")).isEqualTo(Term.THREE_MONTHS);
		assertThat(TermParser.parse("ONE_YEAR")).isEqualTo(Term.ONE_YEAR);
		assertThat(TermParser.parse("P_10_YEARS")).isEqualTo(Term.TEN_YEARS);
	}

	@Test
	void testWhitespaceAndMarkers() throws Exception {
		assertThat(TermParser.parse(" 3 mån*")).isEqualTo(Term.THREE_MONTHS);
		assertThat(TermParser.parse("  2   år ")).isEqualTo(Term.TWO_YEARS);
	}

	@Test
	void testHeadersAreDistinguishable() {
		assertThat(TermParser.isHeader("Bindningstid")).isTrue();
		assertThat(TermParser.isHeader("Månad")).isTrue();
		assertThat(TermParser.isHeader("Genomsnittlig ränta")).isTrue();
		assertThat(TermParser.isHeader("3 mån")).isFalse();

		assertThatThrownBy(() -> TermParser.parse("Bindningstid")).isInstanceOf(TermHeaderException.class);
		assertThatThrownBy(() -> TermParser.parse("Månad")).isInstanceOf(TermHeaderException.class);
	}

	@Test
	void testUnsupportedTerms() {
		assertThatThrownBy(() -> TermParser.parse("11 mån"))
				.isInstanceOf(ValueParseException.class)
				.isNotInstanceOf(TermHeaderException.class);
		assertThatThrownBy(() -> TermParser.parse("Banklån")).isInstanceOf(ValueParseException.class);
		assertThatThrownBy(() -> TermParser.parse("")).isInstanceOf(ValueParseException.class);
		assertThatThrownBy(() -> TermParser.parse("3")).isInstanceOf(ValueParseException.class);
	}

	@Test
	void testFractionalTermsAreUnsupported() {
		assertThat(TermParser.tryParse("2,5 år")).isEmpty();
		assertThat(TermParser.tryParse("1.5 år")).isEmpty();
		assertThat(TermParser.tryParse("0,5 år")).isEmpty();
		assertThat(TermParser.tryParse("ränta, 5 år")).contains(Term.FIVE_YEARS);
	}

	@Test
	void testDeterministic() throws Exception {
		assertThat(TermParser.parse("5 år")).isEqualTo(TermParser.parse("5 år"));
		assertThat(TermParser.tryParse("5 år")).contains(Term.FIVE_YEARS);
		assertThat(TermParser.tryParse("Bindningstid")).isEmpty();
	}

	@Test
	void testFromPeriodBasis() throws Exception {
		assertThat(TermParser.fromPeriodBasis("3", 3)).isEqualTo(Term.THREE_MONTHS);
		assertThat(TermParser.fromPeriodBasis("4", 1)).isEqualTo(Term.ONE_YEAR);
		assertThat(TermParser.fromPeriodBasis("4", 10)).isEqualTo(Term.TEN_YEARS);
		assertThatThrownBy(() -> TermParser.fromPeriodBasis("5", 1)).isInstanceOf(ValueParseException.class);
		assertThatThrownBy(() -> TermParser.fromPeriodBasis("3", 5)).isInstanceOf(ValueParseException.class);
	}
}
