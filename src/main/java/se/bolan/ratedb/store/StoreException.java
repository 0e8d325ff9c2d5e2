package se.bolan.ratedb.store;

/** Thrown when a store can not read or persist records */
public class StoreException extends Exception {
	public StoreException(String message) {
		super(message);
	}

	public StoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
