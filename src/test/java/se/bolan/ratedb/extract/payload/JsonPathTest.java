package se.bolan.ratedb.extract.payload;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class JsonPathTest {
	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void testNavigate() throws Exception {
		// Given
		JsonNode root = objectMapper.readTree("{\"a\":[{\"b\":\"x\"},{\"b\":\"y\"}]}");

		// When/Then
		assertThat(JsonPath.navigate(root, "a", 1, "b").asText()).isEqualTo("y");
		assertThat(JsonPath.array(root, "a").size()).isEqualTo(2);
	}

	@Test
	void testMissingHopNamesPath() throws Exception {
		// Given
		JsonNode root = objectMapper.readTree("{\"a\":[{\"b\":\"x\"}]}");

		// When/Then
		assertThatThrownBy(() -> JsonPath.navigate(root, "a", 0, "c"))
				.isInstanceOf(PayloadShapeException.class)
				.hasMessageContaining("$.a[0].c");
		assertThatThrownBy(() -> JsonPath.navigate(root, "a", 3))
				.isInstanceOf(PayloadShapeException.class)
				.hasMessageContaining("out of range");
		assertThatThrownBy(() -> JsonPath.navigate(root, 0)).isInstanceOf(PayloadShapeException.class);
		assertThatThrownBy(() -> JsonPath.array(root, "a", 0)).isInstanceOf(PayloadShapeException.class);
	}
}
