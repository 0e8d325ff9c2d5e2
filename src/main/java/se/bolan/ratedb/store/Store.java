package se.bolan.ratedb.store;

import java.util.List;
import se.bolan.ratedb.model.InterestSet;

/**
 * Persistence for crawled rates. Implementations must accept upserts from the single consumer
 * thread while other threads read snapshots.
 */
public interface Store {

	/** Insert the record, or replace the stored record that has the same natural key */
	void upsertInterestSet(InterestSet interestSet) throws StoreException;

	/** Snapshot of all stored records */
	List<InterestSet> getInterestSets() throws StoreException;
}
