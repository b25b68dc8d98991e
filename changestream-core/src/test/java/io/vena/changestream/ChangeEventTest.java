package io.vena.changestream;

import io.vena.changestream.token.ResumeToken;
import io.vena.changestream.token.ResumeTokenData;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.junit.jupiter.api.Test;

import static io.vena.changestream.OplogEntries.NS;
import static io.vena.changestream.OplogEntries.TEST_UUID;
import static io.vena.changestream.OplogEntries.doc;
import static io.vena.changestream.OplogEntries.ts;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChangeEventTest {
	static final ResumeToken TOKEN = ResumeToken.fromData(ResumeTokenData.of(ts(1, 1), TEST_UUID, doc("{_id: 1}")));
	static final UpdateDescription DESCRIPTION = new UpdateDescription(doc("{x: 1}"), List.of("y"));

	@Test
	void invalidateWithNamespace_throws() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new ChangeEvent(
			TOKEN, OperationType.INVALIDATE, Optional.of(NS), Optional.empty(), Optional.empty(), Optional.empty()));
		assertThat(e.getMessage(), containsString("namespace"));
	}

	@Test
	void insertWithoutFullDocument_throws() {
		assertThrows(IllegalArgumentException.class, () -> new ChangeEvent(
			TOKEN, OperationType.INSERT, Optional.of(NS), Optional.of(doc("{_id: 1}")), Optional.empty(), Optional.empty()));
	}

	@Test
	void insertWithNullFullDocument_throws() {
		assertThrows(IllegalArgumentException.class, () -> new ChangeEvent(
			TOKEN, OperationType.INSERT, Optional.of(NS), Optional.of(doc("{_id: 1}")), Optional.of(BsonNull.VALUE), Optional.empty()));
	}

	@Test
	void updateWithoutDescription_throws() {
		assertThrows(IllegalArgumentException.class, () -> new ChangeEvent(
			TOKEN, OperationType.UPDATE, Optional.of(NS), Optional.of(doc("{_id: 1}")), Optional.empty(), Optional.empty()));
	}

	@Test
	void deleteWithFullDocument_throws() {
		assertThrows(IllegalArgumentException.class, () -> new ChangeEvent(
			TOKEN, OperationType.DELETE, Optional.of(NS), Optional.of(doc("{_id: 1}")), Optional.of(doc("{_id: 1}")), Optional.empty()));
	}

	@Test
	void updateWithPostImage_works() {
		ChangeEvent event = ChangeEvent.update(TOKEN, NS, doc("{_id: 1}"), DESCRIPTION);
		assertEquals(Optional.of(BsonNull.VALUE), event.withFullDocument(BsonNull.VALUE).fullDocument());
		assertEquals(Optional.of(doc("{_id: 1, x: 1}")), event.withFullDocument(doc("{_id: 1, x: 1}")).fullDocument());
	}

	@Test
	void toBsonDocument_fieldOrder() {
		BsonDocument update = ChangeEvent.update(TOKEN, NS, doc("{_id: 1}"), DESCRIPTION)
			.withFullDocument(doc("{_id: 1, x: 1}"))
			.toBsonDocument();
		assertEquals(
			List.of("_id", "operationType", "fullDocument", "ns", "documentKey", "updateDescription"),
			new ArrayList<>(update.keySet()));
		assertEquals(doc("{db: 'test', coll: 'coll'}"), update.getDocument("ns"));
		assertEquals(doc("{updatedFields: {x: 1}, removedFields: ['y']}"), update.getDocument("updateDescription"));
		assertEquals(TOKEN, ResumeToken.parse(update.get("_id")));
	}

	@Test
	void toBsonDocument_terminalEventHasOnlyIdAndType() {
		BsonDocument retry = ChangeEvent.retryNeeded(TOKEN).toBsonDocument();
		assertEquals(List.of("_id", "operationType"), new ArrayList<>(retry.keySet()));
		assertEquals("retryNeeded", retry.getString("operationType").getValue());
	}
}
