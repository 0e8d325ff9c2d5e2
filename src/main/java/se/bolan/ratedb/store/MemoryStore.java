package se.bolan.ratedb.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import se.bolan.ratedb.model.InterestSet;

/** Thread-safe in-memory store keyed on {@link InterestSet#naturalKey()}, in insertion order */
public class MemoryStore implements Store {
	private final Map<InterestSet.Key, InterestSet> records = new LinkedHashMap<>();

	@Override
	public synchronized void upsertInterestSet(InterestSet interestSet) {
		if (interestSet == null) {
			throw new IllegalArgumentException("Record must not be null");
		}
		records.put(interestSet.naturalKey(), interestSet);
	}

	@Override
	public synchronized List<InterestSet> getInterestSets() {
		return new ArrayList<>(records.values());
	}

	public synchronized int size() {
		return records.size();
	}
}
