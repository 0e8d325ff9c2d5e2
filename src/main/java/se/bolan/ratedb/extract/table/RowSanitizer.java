package se.bolan.ratedb.extract.table;

import java.util.ArrayList;
import java.util.List;
import se.bolan.ratedb.util.ValueParseException;

/**
 * Repairs tables where a publisher split one logical row into a label-only row followed by a
 * values-only row. Applying it to an already repaired table changes nothing.
 */
public class RowSanitizer {

	/** Parser used to decide whether a lone cell is a row label */
	@FunctionalInterface
	public interface LabelParser {
		Object parse(String label) throws ValueParseException;
	}

	private RowSanitizer() {}

	/**
	 * Merge each lone label cell with the row that follows it. Lone cells that are not labels are
	 * dropped, as are empty rows.
	 */
	public static List<List<String>> mergeSplitRows(List<List<String>> rows, LabelParser labelParser) {
		List<List<String>> result = new ArrayList<>();
		for (int i = 0; i < rows.size(); i++) {
			List<String> row = rows.get(i);
			if (row.isEmpty()) {
				continue;
			}
			if (row.size() > 1) {
				result.add(row);
				continue;
			}
			if (!isLabel(row.get(0), labelParser)) {
				continue;
			}
			int next = i + 1;
			while (next < rows.size() && rows.get(next).isEmpty()) {
				next++;
			}
			if (next < rows.size()) {
				List<String> merged = new ArrayList<>(row);
				merged.addAll(rows.get(next));
				result.add(List.copyOf(merged));
				i = next;
			}
		}
		return result;
	}

	private static boolean isLabel(String cell, LabelParser labelParser) {
		try {
			labelParser.parse(cell);
			return true;
		} catch (ValueParseException e) {
			return false;
		}
	}
}
