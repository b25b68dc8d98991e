package io.vena.changestream.mongo.status;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.changestream.token.ResumeToken;
import io.vena.changestream.token.ResumeTokenData;
import org.bson.BsonTimestamp;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OplogWindowTest {
	final ObjectMapper mapper = new ObjectMapper();

	@Test
	void json_omitsError() throws JsonProcessingException {
		OplogWindow window = OplogWindow.of(new BsonTimestamp(100, 1), new BsonTimestamp(200, 2));
		assertEquals(
			mapper.readTree("{\"first\":{\"t\":100,\"i\":1},\"last\":{\"t\":200,\"i\":2}}"),
			mapper.readTree(mapper.writeValueAsString(window)));
	}

	@Test
	void json_unavailable() throws JsonProcessingException {
		assertEquals(
			mapper.readTree("{\"error\":\"empty\"}"),
			mapper.readTree(mapper.writeValueAsString(OplogWindow.unavailable("empty"))));
	}

	@Test
	void canResumeFrom_checksOldestEntry() {
		OplogWindow window = OplogWindow.of(new BsonTimestamp(100, 1), new BsonTimestamp(200, 2));
		assertTrue(window.canResumeFrom(ResumeToken.fromData(ResumeTokenData.of(new BsonTimestamp(100, 1)))));
		assertTrue(window.canResumeFrom(ResumeToken.fromData(ResumeTokenData.of(new BsonTimestamp(150, 0)))));
		assertFalse(window.canResumeFrom(ResumeToken.fromData(ResumeTokenData.of(new BsonTimestamp(99, 9)))));
		assertFalse(OplogWindow.unavailable("empty").canResumeFrom(ResumeToken.fromData(ResumeTokenData.of(new BsonTimestamp(150, 0)))));
	}
}
