package io.vena.changestream;

import java.util.Optional;
import java.util.UUID;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonTimestamp;

/**
 * Hand-made oplog entries shaped the way a MongoDB server writes them.
 */
public final class OplogEntries {
	public static final String DB = "test";
	public static final Namespace NS = new Namespace(DB, "coll");
	public static final Namespace OTHER_NS = new Namespace(DB, "other");
	public static final UUID TEST_UUID = UUID.fromString("3d6b5c52-4aa6-4b8c-9e5a-1bdf6f1c1e01");
	public static final UUID OTHER_UUID = UUID.fromString("8a2d1e30-7f44-4d0b-a0c7-5b3e2f9d6c02");

	private OplogEntries() { }

	public static BsonTimestamp ts(int seconds, int inc) {
		return new BsonTimestamp(seconds, inc);
	}

	public static BsonDocument doc(String json) {
		return BsonDocument.parse(json);
	}

	public static OplogEntry insert(BsonTimestamp ts, Namespace ns, BsonDocument document) {
		return new OplogEntry(ts, OpType.INSERT, Optional.of(ns), Optional.of(TEST_UUID), document, Optional.empty(), false);
	}

	public static OplogEntry update(BsonTimestamp ts, Namespace ns, BsonDocument o, BsonDocument o2) {
		return new OplogEntry(ts, OpType.UPDATE, Optional.of(ns), Optional.of(TEST_UUID), o, Optional.of(o2), false);
	}

	public static OplogEntry delete(BsonTimestamp ts, Namespace ns, BsonDocument key) {
		return new OplogEntry(ts, OpType.DELETE, Optional.of(ns), Optional.of(TEST_UUID), key, Optional.empty(), false);
	}

	public static OplogEntry command(BsonTimestamp ts, String db, Optional<UUID> uuid, BsonDocument body) {
		return new OplogEntry(ts, OpType.COMMAND, Optional.of(Namespace.commandNamespace(db)), uuid, body, Optional.empty(), false);
	}

	public static OplogEntry drop(BsonTimestamp ts, Namespace ns) {
		return command(ts, ns.db(), Optional.of(TEST_UUID), new BsonDocument("drop", new BsonString(ns.coll())));
	}

	public static OplogEntry dropDatabase(BsonTimestamp ts, String db) {
		return command(ts, db, Optional.empty(), doc("{dropDatabase: 1}"));
	}

	public static OplogEntry rename(BsonTimestamp ts, Namespace from, Namespace to) {
		return command(ts, from.db(), Optional.of(TEST_UUID), new BsonDocument()
			.append("renameCollection", new BsonString(from.fullName()))
			.append("to", new BsonString(to.fullName()))
			.append("stayTemp", BsonBoolean.FALSE));
	}

	public static OplogEntry migrationMarker(BsonTimestamp ts, Namespace ns) {
		return new OplogEntry(ts, OpType.NOOP, Optional.of(ns), Optional.of(TEST_UUID),
			doc("{msg: {migrateChunkToNewShard: '" + ns.fullName() + "', fromShard: 'shard0', toShard: 'shard1'}}"),
			Optional.of(new BsonDocument()
				.append("type", new BsonString("migrateChunkToNewShard"))
				.append("fromShard", new BsonString("shard0"))
				.append("toShard", new BsonString("shard1"))),
			true);
	}

	public static OplogEntry newPrimaryNoop(BsonTimestamp ts) {
		return new OplogEntry(ts, OpType.NOOP, Optional.empty(), Optional.empty(), doc("{msg: 'new primary'}"), Optional.empty(), false);
	}
}
