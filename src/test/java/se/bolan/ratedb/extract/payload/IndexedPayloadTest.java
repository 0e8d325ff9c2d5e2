package se.bolan.ratedb.extract.payload;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class IndexedPayloadTest {
	private final ObjectMapper objectMapper = new ObjectMapper();

	private IndexedPayload payload(String json) throws Exception {
		return IndexedPayload.of(objectMapper.readTree(json));
	}

	@Test
	void testDerefFollowsWrappers() throws Exception {
		// Given
		IndexedPayload payload = payload("[[\"Reactive\",1],[\"ShallowRef\",2],{\"name\":3},\"value\"]");

		// When/Then
		assertThat(payload.unwrap(payload.resolve(0)).has("name")).isTrue();
		assertThat(payload.stringField(payload.unwrap(payload.resolve(0)), "name")).contains("value");
	}

	@Test
	void testFieldsDegradeToEmpty() throws Exception {
		// Given
		IndexedPayload payload = payload("[{\"rate\":1,\"text\":2,\"dash\":3,\"broken\":99,\"plain\":\"x\"},3.5,\"4,25\",\"-\"]");
		var object = payload.resolve(0);

		// When/Then
		assertThat(payload.numberField(object, "rate")).contains(3.5);
		assertThat(payload.numberField(object, "text")).contains(4.25);
		assertThat(payload.numberField(object, "dash")).isEmpty();
		assertThat(payload.numberField(object, "broken")).isEmpty();
		assertThat(payload.numberField(object, "plain")).isEmpty();
		assertThat(payload.numberField(object, "missing")).isEmpty();
	}

	@Test
	void testIndirectionLimit() throws Exception {
		// Given
		IndexedPayload payload =
				payload("[[\"Ref\",1],[\"Ref\",2],[\"Ref\",3],[\"Ref\",4],[\"Ref\",5],{\"deep\":true}]");

		// When/Then
		assertThatThrownBy(() -> payload.unwrap(payload.resolve(0)))
				.isInstanceOf(PayloadShapeException.class)
				.hasMessageContaining("indirections");
		assertThat(payload.unwrap(payload.resolve(1)).has("deep")).isTrue();
	}

	@Test
	void testOutOfRangeIndex() throws Exception {
		// Given
		IndexedPayload payload = payload("[[1,7,2],\"a\",\"b\"]");

		// When
		List<String> values = payload.derefAll(payload.resolve(0)).stream()
				.map(node -> node.asText())
				.toList();

		// Then
		assertThat(values).containsExactly("a", "b");
		assertThatThrownBy(() -> payload.resolve(5)).isInstanceOf(PayloadShapeException.class);
	}

	@Test
	void testObjectsWithKey() throws Exception {
		// Given
		IndexedPayload payload = payload("[{\"monthPeriod\":1},\"2025-10\",{\"other\":1},{\"monthPeriod\":1}]");

		// When/Then
		assertThat(payload.objectsWithKey("monthPeriod")).hasSize(2);
	}

	@Test
	void testRootMustBeArray() {
		assertThatThrownBy(() -> payload("{\"a\":1}")).isInstanceOf(PayloadShapeException.class);
	}
}
