package se.bolan.ratedb.store;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.bolan.ratedb.model.InterestSet;
import se.bolan.ratedb.model.RatioDiscountBoundary;

/**
 * Store backed by a single JSON array file. Records are kept in memory and the file is only
 * rewritten on {@link #flush()}, sorted so that unchanged data gives an unchanged file.
 */
public class JsonFileStore implements Store {
	private static final Logger logger = LoggerFactory.getLogger(JsonFileStore.class);

	private static final ObjectMapper readMapper = new ObjectMapper();

	private static final ObjectMapper writeMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	static final Comparator<InterestSet> ORDER = Comparator.comparing(InterestSet::bank)
			.thenComparing(InterestSet::type)
			.thenComparing(InterestSet::term)
			.thenComparing(InterestSet::averageReferenceMonth, Comparator.nullsFirst(Comparator.naturalOrder()))
			.thenComparing(InterestSet::changedOn, Comparator.nullsFirst(Comparator.naturalOrder()))
			.thenComparing(
					InterestSet::ratioDiscountBoundaries,
					Comparator.nullsFirst(Comparator.comparingDouble(RatioDiscountBoundary::minRatio)
							.thenComparingDouble(RatioDiscountBoundary::maxRatio)));

	private final Path file;
	private final MemoryStore records = new MemoryStore();

	private JsonFileStore(Path file) {
		this.file = file;
	}

	/**
	 * Open a store on the given file, loading its records if it exists.
	 *
	 * @throws StoreException if the existing file can not be read
	 */
	public static JsonFileStore open(Path file) throws StoreException {
		JsonFileStore store = new JsonFileStore(file);
		if (Files.exists(file)) {
			try {
				List<InterestSet> existing = readMapper.readValue(file.toFile(), new TypeReference<List<InterestSet>>() {});
				existing.forEach(store.records::upsertInterestSet);
				logger.info("Loaded {} records from {}", existing.size(), file);
			} catch (IOException e) {
				throw new StoreException("Failed to read " + file + ": " + e.getMessage(), e);
			}
		}
		return store;
	}

	@Override
	public void upsertInterestSet(InterestSet interestSet) {
		records.upsertInterestSet(interestSet);
	}

	@Override
	public List<InterestSet> getInterestSets() {
		return records.getInterestSets();
	}

	/** Write all records to the file, sorted */
	public void flush() throws StoreException {
		List<InterestSet> sorted = records.getInterestSets().stream().sorted(ORDER).toList();
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
			try (var writer = Files.newBufferedWriter(tmp)) {
				writeMapper.writeValue(writer, sorted);
				writer.write("\n");
			}
			Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
			logger.info("Wrote {} records to {}", sorted.size(), file);
		} catch (IOException e) {
			throw new StoreException("Failed to write " + file + ": " + e.getMessage(), e);
		}
	}
}
