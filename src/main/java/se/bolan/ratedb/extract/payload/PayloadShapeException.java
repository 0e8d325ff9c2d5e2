package se.bolan.ratedb.extract.payload;

import se.bolan.ratedb.extract.ExtractionException;

/** Thrown when embedded application state does not have the structure a crawler navigates */
public class PayloadShapeException extends ExtractionException {
	public PayloadShapeException(String message) {
		super(message);
	}
}
