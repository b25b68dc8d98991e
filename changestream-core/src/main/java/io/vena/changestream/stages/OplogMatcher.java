package io.vena.changestream.stages;

import io.vena.changestream.ChangeStreamScope;
import io.vena.changestream.Namespace;
import io.vena.changestream.OplogEntry;
import java.util.Optional;
import java.util.function.Predicate;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Decides which oplog entries could produce an event for a given scope.
 * Everything else, including index builds, collection creation,
 * and writes to <code>system.*</code> collections, is dropped here.
 */
public final class OplogMatcher implements Predicate<OplogEntry> {
	public static final String MIGRATE_CHUNK_MARKER = "migrateChunkToNewShard";

	static final String DROP = "drop";
	static final String DROP_DATABASE = "dropDatabase";
	static final String RENAME_COLLECTION = "renameCollection";
	static final String RENAME_TARGET = "to";
	static final String MARKER_TYPE = "type";

	private final ChangeStreamScope scope;
	private final BsonTimestamp startAt;
	private final boolean inclusive;

	/**
	 * @param inclusive if true, an entry at exactly <code>startAt</code> is a candidate;
	 *                  used when resuming, because the event we resume from must be seen again to be recognized.
	 */
	public OplogMatcher(ChangeStreamScope scope, BsonTimestamp startAt, boolean inclusive) {
		this.scope = requireNonNull(scope);
		this.startAt = requireNonNull(startAt);
		this.inclusive = inclusive;
	}

	@Override
	public boolean test(OplogEntry entry) {
		int sinceStart = Long.compareUnsigned(entry.timestamp().getValue(), startAt.getValue());
		if (sinceStart < 0 || (sinceStart == 0 && !inclusive)) {
			LOGGER.trace("Dropping {}: before start position", entry);
			return false;
		}
		boolean result = switch (entry.opType()) {
			case INSERT, UPDATE, DELETE -> !entry.fromMigrate() && scope.containsCollection(entry.namespace());
			case COMMAND -> !entry.fromMigrate() && isInvalidatingCommand(entry);
			case NOOP -> isMigrationMarker(entry) && scope.containsCollection(entry.namespace());
		};
		if (!result) {
			LOGGER.trace("Dropping {}: irrelevant to {}", entry, scope);
		}
		return result;
	}

	private boolean isInvalidatingCommand(OplogEntry entry) {
		BsonDocument command = entry.object();
		Optional<String> renameTarget = stringField(command, RENAME_TARGET);
		if (command.containsKey(RENAME_COLLECTION) && renameTarget.isPresent() && inScope(renameTarget.get())) {
			return true;
		}
		if (entry.namespace().isEmpty() || !entry.namespace().get().isCommand()) {
			return false;
		}
		String db = entry.namespace().get().db();
		if (command.containsKey(DROP)) {
			return stringField(command, DROP)
				.map(coll -> scope.containsCollection(new Namespace(db, coll)))
				.orElse(false);
		} else if (command.containsKey(DROP_DATABASE)) {
			return scope.containsDatabase(db);
		} else if (command.containsKey(RENAME_COLLECTION)) {
			return stringField(command, RENAME_COLLECTION)
				.map(this::inScope)
				.orElse(false);
		} else {
			return false;
		}
	}

	private boolean inScope(String fullName) {
		try {
			return scope.containsCollection(Namespace.parse(fullName));
		} catch (IllegalArgumentException e) {
			LOGGER.debug("Ignoring malformed namespace \"{}\"", fullName, e);
			return false;
		}
	}

	/**
	 * Chunk migrations write a noop whose <code>o2</code> announces that a
	 * collection's documents are now also on another shard.
	 */
	static boolean isMigrationMarker(OplogEntry entry) {
		return entry.object2()
			.flatMap(o2 -> stringField(o2, MARKER_TYPE))
			.map(MIGRATE_CHUNK_MARKER::equals)
			.orElse(false);
	}

	static Optional<String> stringField(BsonDocument doc, String name) {
		BsonValue value = doc.get(name);
		if (value != null && value.isString()) {
			return Optional.of(value.asString().getValue());
		} else {
			return Optional.empty();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OplogMatcher.class);
}
