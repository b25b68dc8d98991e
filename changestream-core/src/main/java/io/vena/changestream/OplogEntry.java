package io.vena.changestream;

import java.util.Optional;
import java.util.UUID;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;

import static java.util.Objects.requireNonNull;

/**
 * One record of the replicated operation log.
 *
 * @param timestamp unique per record and strictly increasing in the order records are read
 * @param namespace absent on some noop records
 * @param uuid identifies the collection; absent on records written before collections had UUIDs
 * @param object the inserted document, the update modifier or replacement, the deleted document's key, or the command body
 * @param object2 for updates, the document key; for noops, the marker body
 * @param fromMigrate set on writes performed by chunk migration, which clients must not see
 */
public record OplogEntry(
	BsonTimestamp timestamp,
	OpType opType,
	Optional<Namespace> namespace,
	Optional<UUID> uuid,
	BsonDocument object,
	Optional<BsonDocument> object2,
	boolean fromMigrate
) {
	public OplogEntry {
		requireNonNull(timestamp);
		requireNonNull(opType);
		requireNonNull(namespace);
		requireNonNull(uuid);
		requireNonNull(object);
		requireNonNull(object2);
	}

	public OplogEntry withUuid(UUID newUuid) {
		return new OplogEntry(timestamp, opType, namespace, Optional.of(newUuid), object, object2, fromMigrate);
	}

	public OplogEntry withFromMigrate(boolean newFromMigrate) {
		return new OplogEntry(timestamp, opType, namespace, uuid, object, object2, newFromMigrate);
	}

	/**
	 * For commands, the database named by the <code>db.$cmd</code> namespace.
	 */
	public Optional<String> db() {
		return namespace.map(Namespace::db);
	}

	@Override
	public String toString() {
		return "OplogEntry{" + opType.code() + " " + timestamp.getTime() + ":" + timestamp.getInc()
			+ namespace.map(ns -> " " + ns).orElse("")
			+ (fromMigrate ? " fromMigrate" : "")
			+ "}";
	}
}
