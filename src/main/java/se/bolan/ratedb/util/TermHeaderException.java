package se.bolan.ratedb.util;

/**
 * Thrown by {@link TermParser} when the text is a column or row label rather than a term. Callers
 * skip such rows without reporting them.
 */
public class TermHeaderException extends ValueParseException {
	public TermHeaderException(String text) {
		super("Not a term but a header label: " + text);
	}
}
