package se.bolan.ratedb.extract;

/**
 * Thrown when a document does not have the expected shape, for example a missing anchor text or an
 * unexpected JSON structure. The whole document is unusable when this is thrown.
 */
public class ExtractionException extends Exception {
	public ExtractionException(String message) {
		super(message);
	}

	public ExtractionException(String message, Throwable cause) {
		super(message, cause);
	}
}
