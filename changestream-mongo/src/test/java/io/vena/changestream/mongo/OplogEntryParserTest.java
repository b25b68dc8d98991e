package io.vena.changestream.mongo;

import io.vena.changestream.Namespace;
import io.vena.changestream.OpType;
import io.vena.changestream.OplogEntry;
import java.util.Optional;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;
import org.junit.jupiter.api.Test;

import static io.vena.changestream.OplogEntries.TEST_UUID;
import static io.vena.changestream.OplogEntries.doc;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OplogEntryParserTest {
	final OplogEntryParser parser = new OplogEntryParser();

	@Test
	void update_allFields() {
		BsonDocument raw = doc("{ts: {$timestamp: {t: 1700000000, i: 3}}, t: 1, h: 0, v: 2, op: 'u', ns: 'test.coll',"
			+ " o: {$v: 1, $set: {x: 5}}, o2: {_id: 1}, wall: {$date: 0}}")
			.append("ui", new BsonBinary(TEST_UUID));
		OplogEntry entry = parser.parse(raw);

		assertEquals(new BsonTimestamp(1700000000, 3), entry.timestamp());
		assertEquals(OpType.UPDATE, entry.opType());
		assertEquals(Optional.of(new Namespace("test", "coll")), entry.namespace());
		assertEquals(Optional.of(TEST_UUID), entry.uuid());
		assertEquals(doc("{$v: 1, $set: {x: 5}}"), entry.object());
		assertEquals(Optional.of(doc("{_id: 1}")), entry.object2());
		assertFalse(entry.fromMigrate());
	}

	@Test
	void noopWithEmptyNamespace_hasNoNamespace() {
		OplogEntry entry = parser.parse(doc("{ts: {$timestamp: {t: 1, i: 1}}, op: 'n', ns: '', o: {msg: 'new primary'}}"));
		assertEquals(OpType.NOOP, entry.opType());
		assertEquals(Optional.empty(), entry.namespace());
		assertEquals(Optional.empty(), entry.uuid());
	}

	@Test
	void fromMigrate_read() {
		OplogEntry entry = parser.parse(doc("{ts: {$timestamp: {t: 1, i: 1}}, op: 'i', ns: 'test.coll', o: {_id: 1}, fromMigrate: true}"));
		assertTrue(entry.fromMigrate());
	}

	@Test
	void commandNamespace_parsed() {
		OplogEntry entry = parser.parse(doc("{ts: {$timestamp: {t: 1, i: 1}}, op: 'c', ns: 'test.$cmd', o: {dropDatabase: 1}}"));
		assertTrue(entry.namespace().get().isCommand());
	}

	@Test
	void unknownOp_throws() {
		BsonFormatException e = assertThrows(BsonFormatException.class,
			() -> parser.parse(doc("{ts: {$timestamp: {t: 1, i: 1}}, op: 'x', ns: 'test.coll', o: {}}")));
		assertThat(e.getMessage(), containsString("\"x\""));
	}

	@Test
	void missingTimestamp_throws() {
		assertThrows(BsonFormatException.class, () -> parser.parse(doc("{op: 'i', ns: 'test.coll', o: {}}")));
	}

	@Test
	void wrongFieldType_throws() {
		assertThrows(BsonFormatException.class, () -> parser.parse(doc("{ts: 5, op: 'i', ns: 'test.coll', o: {}}")));
		assertThrows(BsonFormatException.class, () -> parser.parse(doc("{ts: {$timestamp: {t: 1, i: 1}}, op: 'i', ns: 'test.coll', o: 'nope'}")));
	}

	@Test
	void legacyUuidSubtype_throws() {
		BsonDocument raw = doc("{ts: {$timestamp: {t: 1, i: 1}}, op: 'i', ns: 'test.coll', o: {_id: 1}}")
			.append("ui", new BsonBinary((byte) 3, new byte[16]));
		assertThrows(BsonFormatException.class, () -> parser.parse(raw));
	}
}
