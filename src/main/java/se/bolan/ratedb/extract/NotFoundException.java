package se.bolan.ratedb.extract;

/** Thrown when an anchor text, table or embedded data blob is not present in a document */
public class NotFoundException extends ExtractionException {
	public NotFoundException(String message) {
		super(message);
	}
}
