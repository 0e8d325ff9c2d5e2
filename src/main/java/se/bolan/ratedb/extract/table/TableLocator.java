package se.bolan.ratedb.extract.table;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import se.bolan.ratedb.extract.NotFoundException;
import se.bolan.ratedb.util.TextUtils;

/**
 * Finds tables in HTML documents by a known piece of text. Markup is parsed with jsoup's HTML5 tree
 * builder, which closes unterminated cells and rows and adds missing {@code <tr>} elements before
 * anything is located.
 */
public class TableLocator {

	private TableLocator() {}

	public static Document parse(String html) {
		return Jsoup.parse(html);
	}

	/** Find and parse the first table that follows the anchor text */
	public static HtmlTable byTextBefore(String html, String anchor) throws NotFoundException {
		return HtmlTable.parse(findByTextBefore(parse(html), anchor, 0));
	}

	/** Find and parse the table that follows the anchor text, skipping {@code skip} tables first */
	public static HtmlTable byTextBefore(String html, String anchor, int skip) throws NotFoundException {
		return HtmlTable.parse(findByTextBefore(parse(html), anchor, skip));
	}

	/** Find and parse the first table whose caption contains the anchor text */
	public static HtmlTable byCaption(String html, String anchor) throws NotFoundException {
		return HtmlTable.parse(findByCaption(parse(html), anchor));
	}

	/** Find and parse the first table whose first header cell equals the given text, ignoring case */
	public static HtmlTable byFirstHeader(String html, String headerText) throws NotFoundException {
		String needle = TextUtils.normalizeSpaces(headerText);
		for (Element element : parse(html).getElementsByTag("table")) {
			HtmlTable table = HtmlTable.parse(element);
			if (table.headerCell(0).equalsIgnoreCase(needle)) {
				return table;
			}
		}
		throw new NotFoundException("Failed to find table with header '" + headerText + "'");
	}

	/**
	 * Locate a table by the text preceding it. The first text node containing the anchor wins, then
	 * tables starting after it are counted in document order.
	 *
	 * @param skip How many following tables to pass over, 0 for the first one
	 * @throws NotFoundException if the anchor text or a following table is missing
	 */
	public static Element findByTextBefore(Document document, String anchor, int skip) throws NotFoundException {
		var visitor = new AnchoredTableFilter(TextUtils.normalizeSpaces(anchor), skip);
		NodeTraversor.filter(visitor, document);
		if (!visitor.anchorFound) {
			throw new NotFoundException("Failed to find text '" + anchor + "' before table");
		}
		if (visitor.table == null) {
			throw new NotFoundException("Failed to find table after text '" + anchor + "'");
		}
		return visitor.table;
	}

	/** Locate the first table having a {@code <caption>} that contains the anchor text */
	public static Element findByCaption(Document document, String anchor) throws NotFoundException {
		String needle = TextUtils.normalizeSpaces(anchor);
		for (Element table : document.getElementsByTag("table")) {
			for (Element child : table.children()) {
				if (child.normalName().equals("caption")
						&& TextUtils.normalizeSpaces(child.text()).contains(needle)) {
					return table;
				}
			}
		}
		throw new NotFoundException("Failed to find table with caption '" + anchor + "'");
	}

	/** Walks nodes in document order and stops at the requested table after the anchor */
	private static class AnchoredTableFilter implements NodeFilter {
		private final String anchor;
		private int remaining;
		private boolean anchorFound;
		private Element table;

		AnchoredTableFilter(String anchor, int skip) {
			this.anchor = anchor;
			this.remaining = skip;
		}

		@Override
		public FilterResult head(Node node, int depth) {
			if (!anchorFound) {
				if (node instanceof TextNode
						&& TextUtils.normalizeSpaces(((TextNode) node).getWholeText()).contains(anchor)) {
					anchorFound = true;
				}
				return FilterResult.CONTINUE;
			}
			if (node instanceof Element && ((Element) node).normalName().equals("table")) {
				if (remaining == 0) {
					table = (Element) node;
					return FilterResult.STOP;
				}
				remaining--;
			}
			return FilterResult.CONTINUE;
		}

		@Override
		public FilterResult tail(Node node, int depth) {
			return FilterResult.CONTINUE;
		}
	}
}
