package se.bolan.ratedb.extract.payload;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Walks a fixed sequence of object keys and array indices through a JSON tree. Any hop that does
 * not exist fails the whole navigation.
 */
public class JsonPath {

	private JsonPath() {}

	/**
	 * Follow the hops from the root.
	 *
	 * @param hops {@link String} keys for objects and {@link Integer} indices for arrays
	 * @throws PayloadShapeException naming the path walked so far when a hop is missing or the node
	 *     has the wrong type
	 */
	public static JsonNode navigate(JsonNode root, Object... hops) throws PayloadShapeException {
		JsonNode node = root;
		var walked = new StringBuilder("$");
		for (Object hop : hops) {
			if (hop instanceof String) {
				String key = (String) hop;
				if (node == null || !node.isObject()) {
					throw new PayloadShapeException("Expected object at " + walked + " to read '" + key + "'");
				}
				node = node.get(key);
				walked.append('.').append(key);
				if (node == null || node.isNull()) {
					throw new PayloadShapeException("Missing key at " + walked);
				}
			} else if (hop instanceof Integer) {
				int index = (Integer) hop;
				if (node == null || !node.isArray()) {
					throw new PayloadShapeException("Expected array at " + walked + " to read [" + index + "]");
				}
				if (index < 0 || index >= node.size()) {
					throw new PayloadShapeException(
							"Index " + index + " out of range at " + walked + " (size " + node.size() + ")");
				}
				node = node.get(index);
				walked.append('[').append(index).append(']');
			} else {
				throw new IllegalArgumentException("Unsupported path hop: " + hop);
			}
		}
		return node;
	}

	/** Like {@link #navigate} but also requires the target to be an array */
	public static JsonNode array(JsonNode root, Object... hops) throws PayloadShapeException {
		JsonNode node = navigate(root, hops);
		if (!node.isArray()) {
			throw new PayloadShapeException("Expected array at end of path but found " + node.getNodeType());
		}
		return node;
	}
}
