package se.bolan.ratedb.extract.sheet;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/** A spreadsheet cell value, keeping numbers numeric */
public record SheetCell(String text, BigDecimal number) {
	private static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);

	public static final SheetCell EMPTY = new SheetCell("", null);

	public static SheetCell ofText(String text) {
		return new SheetCell(text != null ? text : "", null);
	}

	public static SheetCell ofNumber(BigDecimal number) {
		return new SheetCell(number.toPlainString(), number);
	}

	public boolean isNumber() {
		return number != null;
	}

	public boolean isBlank() {
		return number == null && text.isBlank();
	}

	/** Interpret a numeric cell as an Excel serial date */
	public Optional<LocalDate> serialDate() {
		if (number == null || number.signum() <= 0 || number.compareTo(BigDecimal.valueOf(2958465)) > 0) {
			return Optional.empty();
		}
		return Optional.of(EXCEL_EPOCH.plusDays(number.longValue()));
	}

	@Override
	public String toString() {
		return text;
	}
}
