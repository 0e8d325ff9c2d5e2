package se.bolan.ratedb.util;

/** Thrown when a single term, rate or date token cannot be interpreted */
public class ValueParseException extends Exception {
	public ValueParseException(String message) {
		super(message);
	}

	public ValueParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
