package se.bolan.ratedb.util;

import static org.assertj.core.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import se.bolan.ratedb.model.AvgMonth;

class DateParsersTest {

	@Test
	void testFullDates() throws Exception {
		assertThat(DateParsers.isoDate("2025-10-01")).isEqualTo(LocalDate.of(2025, 10, 1));
		assertThat(DateParsers.isoDateTime("2025-11-10T00:00:00.000Z")).isEqualTo(LocalDate.of(2025, 11, 10));
		assertThat(DateParsers.dottedDate("2025.10.01")).isEqualTo(LocalDate.of(2025, 10, 1));
		assertThat(DateParsers.dayMonthNameYear("1 oktober 2025")).isEqualTo(LocalDate.of(2025, 10, 1));
		assertThat(DateParsers.dayMonthNameYear("25 sep. 2025")).isEqualTo(LocalDate.of(2025, 9, 25));
	}

	@Test
	void testShortUsDateCentury() throws Exception {
		assertThat(DateParsers.monthDayShortYear("10-31-25")).isEqualTo(LocalDate.of(2025, 10, 31));
		assertThat(DateParsers.monthDayShortYear("03-15-95")).isEqualTo(LocalDate.of(1995, 3, 15));
	}

	@Test
	void testMonthNotations() throws Exception {
		assertThat(DateParsers.yearMonthDashed("2025-10")).isEqualTo(new AvgMonth(2025, 10));
		assertThat(DateParsers.yearMonthCompact("202510")).isEqualTo(new AvgMonth(2025, 10));
		assertThat(DateParsers.yearMonthCompact(202510)).isEqualTo(new AvgMonth(2025, 10));
		assertThat(DateParsers.yearSpaceMonth("2025 10")).isEqualTo(new AvgMonth(2025, 10));
		assertThat(DateParsers.monthNameYear("Oktober 2025")).isEqualTo(new AvgMonth(2025, 10));
		assertThat(DateParsers.monthNameYear("nov. 2025")).isEqualTo(new AvgMonth(2025, 11));
		assertThat(DateParsers.yearMonthName("2025 november")).isEqualTo(new AvgMonth(2025, 11));
		assertThat(DateParsers.yyyymmdd("20251031")).isEqualTo(new AvgMonth(2025, 10));
	}

	@Test
	void testYymmCenturyPivot() throws Exception {
		assertThat(DateParsers.yymm(2510)).isEqualTo(new AvgMonth(2025, 10));
		assertThat(DateParsers.yymm(3912)).isEqualTo(new AvgMonth(2039, 12));
		assertThat(DateParsers.yymm(4001)).isEqualTo(new AvgMonth(1940, 1));
	}

	@Test
	void testRejectsInvalidMonthsAndYears() {
		assertThatThrownBy(() -> DateParsers.yearMonthCompact("202513")).isInstanceOf(ValueParseException.class);
		assertThatThrownBy(() -> DateParsers.yearMonthDashed("1899-01")).isInstanceOf(ValueParseException.class);
		assertThatThrownBy(() -> DateParsers.monthNameYear("Smarch 2025")).isInstanceOf(ValueParseException.class);
		assertThatThrownBy(() -> DateParsers.isoDate("2025-02-30")).isInstanceOf(ValueParseException.class);
		assertThatThrownBy(() -> DateParsers.yymm(2513)).isInstanceOf(ValueParseException.class);
	}
}
