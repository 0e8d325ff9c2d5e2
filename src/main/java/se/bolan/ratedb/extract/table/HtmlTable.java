package se.bolan.ratedb.extract.table;

import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import se.bolan.ratedb.util.TextUtils;

/**
 * A parsed HTML table. The first non-empty row is the header, the remaining rows follow in document
 * order. Short rows are not padded, so callers check the row length before indexing.
 */
public record HtmlTable(List<String> header, List<List<String>> rows) {

	public HtmlTable {
		header = List.copyOf(header);
		rows = rows.stream().map(List::copyOf).toList();
	}

	/** Parse a {@code <table>} element, ignoring rows of tables nested inside it */
	public static HtmlTable parse(Element table) {
		List<List<String>> all = new ArrayList<>();
		for (Element row : table.select("tr")) {
			if (row.closest("table") != table) {
				continue;
			}
			List<String> cells = new ArrayList<>();
			for (Element cell : row.children()) {
				if (cell.normalName().equals("td") || cell.normalName().equals("th")) {
					cells.add(cellText(cell));
				}
			}
			if (!cells.isEmpty()) {
				all.add(cells);
			}
		}
		if (all.isEmpty()) {
			return new HtmlTable(List.of(), List.of());
		}
		return new HtmlTable(all.get(0), all.subList(1, all.size()));
	}

	/** Header cell at the given index, or an empty string if the header is shorter */
	public String headerCell(int index) {
		return index < header.size() ? header.get(index) : "";
	}

	/**
	 * Concatenate every descendant text node. Line breaks do not add a separator, so {@code
	 * Part1<br>Part2} reads as {@code Part1Part2}.
	 */
	static String cellText(Element cell) {
		var sb = new StringBuilder();
		NodeTraversor.traverse(
				(node, depth) -> {
					if (node instanceof TextNode) {
						sb.append(((TextNode) node).getWholeText());
					}
				},
				cell);
		return TextUtils.normalizeSpaces(sb.toString());
	}
}
