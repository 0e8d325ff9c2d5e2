package se.bolan.ratedb.extract.sheet;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.dhatim.fastexcel.reader.Cell;
import org.dhatim.fastexcel.reader.ReadableWorkbook;
import org.dhatim.fastexcel.reader.Row;
import org.dhatim.fastexcel.reader.Sheet;
import se.bolan.ratedb.extract.ExtractionException;
import se.bolan.ratedb.extract.NotFoundException;
import se.bolan.ratedb.util.TextUtils;

/** Reads the rows of one sheet of an XLSX workbook */
public class SheetReader {

	private SheetReader() {}

	/**
	 * Read the first sheet whose name contains one of the keywords, falling back to the first sheet
	 * that is not a chart sheet.
	 *
	 * @throws NotFoundException if the workbook has no usable sheet
	 * @throws ExtractionException if the bytes are not a readable workbook
	 */
	public static List<List<SheetCell>> read(byte[] xlsx, List<String> sheetKeywords) throws ExtractionException {
		try (var workbook = new ReadableWorkbook(new ByteArrayInputStream(xlsx))) {
			Sheet sheet = selectSheet(workbook, sheetKeywords)
					.orElseThrow(() -> new NotFoundException("Workbook has no data sheet"));
			List<List<SheetCell>> rows = new ArrayList<>();
			try (Stream<Row> stream = sheet.openStream()) {
				stream.forEach(row -> rows.add(cells(row)));
			}
			return rows;
		} catch (IOException | RuntimeException e) {
			throw new ExtractionException("Failed to read workbook: " + e.getMessage(), e);
		}
	}

	static Optional<Sheet> selectSheet(ReadableWorkbook workbook, List<String> keywords) {
		List<Sheet> sheets = workbook.getSheets().toList();
		for (Sheet sheet : sheets) {
			String name = sheet.getName().toLowerCase(Locale.ROOT);
			if (keywords.stream().anyMatch(k -> name.contains(k.toLowerCase(Locale.ROOT)))) {
				return Optional.of(sheet);
			}
		}
		return sheets.stream()
				.filter(s -> !s.getName().toLowerCase(Locale.ROOT).contains("diagram"))
				.findFirst();
	}

	private static List<SheetCell> cells(Row row) {
		List<SheetCell> cells = new ArrayList<>();
		for (int i = 0; i < row.getCellCount(); i++) {
			cells.add(row.getOptionalCell(i).map(SheetReader::cell).orElse(SheetCell.EMPTY));
		}
		return cells;
	}

	private static SheetCell cell(Cell cell) {
		return switch (cell.getType()) {
			case NUMBER -> SheetCell.ofNumber(cell.asNumber());
			case STRING -> SheetCell.ofText(TextUtils.normalizeSpaces(cell.asString()));
			case EMPTY -> SheetCell.EMPTY;
			default -> SheetCell.ofText(TextUtils.normalizeSpaces(cell.getRawValue()));
		};
	}
}
