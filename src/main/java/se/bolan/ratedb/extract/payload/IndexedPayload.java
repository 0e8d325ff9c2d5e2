package se.bolan.ratedb.extract.payload;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import se.bolan.ratedb.util.TextUtils;

/**
 * Page state serialized as one flat JSON array in which numbers inside objects and arrays are
 * indices of other elements of the same array, as produced by Nuxt's {@code _payload.json}.
 *
 * <p>Every index is bounds-checked before it is dereferenced, and reactive wrappers such as {@code
 * ["Reactive", 12]} are followed at most {@value #MAX_INDIRECTIONS} times, so malformed input can
 * not cause unbounded lookups.
 */
public class IndexedPayload {
	public static final int MAX_INDIRECTIONS = 4;

	private static final Set<String> WRAPPERS = Set.of("Reactive", "ShallowReactive", "Ref", "ShallowRef");

	private final JsonNode elements;

	private IndexedPayload(JsonNode elements) {
		this.elements = elements;
	}

	/** @throws PayloadShapeException if the root is not an array */
	public static IndexedPayload of(JsonNode root) throws PayloadShapeException {
		if (root == null || !root.isArray()) {
			throw new PayloadShapeException("Expected a flat payload array");
		}
		return new IndexedPayload(root);
	}

	public int size() {
		return elements.size();
	}

	/** The element at the given index */
	public JsonNode resolve(int index) throws PayloadShapeException {
		if (index < 0 || index >= elements.size()) {
			throw new PayloadShapeException("Payload index " + index + " out of range (size " + elements.size() + ")");
		}
		return elements.get(index);
	}

	/** Dereference a node holding an index, then unwrap any reactive wrappers around the target */
	public JsonNode deref(JsonNode reference) throws PayloadShapeException {
		if (reference == null || !reference.isIntegralNumber()) {
			throw new PayloadShapeException("Expected an index but found " + describe(reference));
		}
		return unwrap(resolve(reference.asInt()));
	}

	/** Follow wrappers like {@code ["Reactive", idx]} until a plain value is reached */
	public JsonNode unwrap(JsonNode node) throws PayloadShapeException {
		JsonNode current = node;
		for (int hops = 0; isWrapper(current); hops++) {
			if (hops >= MAX_INDIRECTIONS) {
				throw new PayloadShapeException("Too many indirections in payload");
			}
			current = resolve(current.get(1).asInt());
		}
		return current;
	}

	/**
	 * Resolve a field of an object element. Returns empty when the field is missing, is not an index
	 * or points outside the payload, so a broken field only loses that one value.
	 */
	public Optional<JsonNode> field(JsonNode object, String name) {
		if (object == null || !object.isObject() || !object.has(name)) {
			return Optional.empty();
		}
		try {
			return Optional.of(deref(object.get(name)));
		} catch (PayloadShapeException e) {
			return Optional.empty();
		}
	}

	/** Field that resolves to a text value */
	public Optional<String> stringField(JsonNode object, String name) {
		return field(object, name).filter(JsonNode::isTextual).map(JsonNode::asText);
	}

	/**
	 * Field that resolves to a number, or to a text holding a number. Placeholders such as {@code
	 * "-"} give empty.
	 */
	public Optional<Double> numberField(JsonNode object, String name) {
		Optional<JsonNode> value = field(object, name);
		if (value.isEmpty()) {
			return Optional.empty();
		}
		JsonNode node = value.get();
		if (node.isNumber()) {
			return Optional.of(node.asDouble());
		}
		if (node.isTextual() && !TextUtils.isPlaceholder(node.asText())) {
			try {
				return Optional.of(Double.parseDouble(node.asText().trim().replace(',', '.')));
			} catch (NumberFormatException e) {
				return Optional.empty();
			}
		}
		return Optional.empty();
	}

	/** Dereference each index of an array element, dropping indices that do not resolve */
	public List<JsonNode> derefAll(JsonNode array) throws PayloadShapeException {
		if (array == null || !array.isArray()) {
			throw new PayloadShapeException("Expected an array of indices but found " + describe(array));
		}
		List<JsonNode> result = new ArrayList<>();
		for (JsonNode reference : array) {
			if (reference.isIntegralNumber() && reference.asInt() >= 0 && reference.asInt() < elements.size()) {
				result.add(elements.get(reference.asInt()));
			}
		}
		return result;
	}

	/** All object elements that have the given key, in payload order */
	public List<JsonNode> objectsWithKey(String key) {
		List<JsonNode> result = new ArrayList<>();
		for (JsonNode element : elements) {
			if (element.isObject() && element.has(key)) {
				result.add(element);
			}
		}
		return result;
	}

	private static boolean isWrapper(JsonNode node) {
		return node != null
				&& node.isArray()
				&& node.size() == 2
				&& node.get(0).isTextual()
				&& WRAPPERS.contains(node.get(0).asText())
				&& node.get(1).isIntegralNumber();
	}

	private static String describe(JsonNode node) {
		return node == null ? "nothing" : node.getNodeType().toString();
	}
}
