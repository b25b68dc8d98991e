package io.vena.changestream.mongo;

import io.vena.changestream.Namespace;
import io.vena.changestream.OpType;
import io.vena.changestream.OplogEntry;
import java.util.Optional;
import java.util.UUID;
import org.bson.BsonBinary;
import org.bson.BsonBinarySubType;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;

/**
 * Reads documents from <code>local.oplog.rs</code>.
 * Fields we don't use (<code>h</code>, <code>v</code>, <code>wall</code>, <code>lsid</code>, ...) are ignored.
 */
public final class OplogEntryParser {
	static final String TIMESTAMP = "ts";
	static final String OP = "op";
	static final String NAMESPACE = "ns";
	static final String UUID_FIELD = "ui";
	static final String OBJECT = "o";
	static final String OBJECT_2 = "o2";
	static final String FROM_MIGRATE = "fromMigrate";

	/**
	 * @throws BsonFormatException if <code>doc</code> is not a recognizable oplog entry
	 */
	public OplogEntry parse(BsonDocument doc) {
		try {
			return parseFields(doc);
		} catch (BsonInvalidOperationException e) {
			throw new BsonFormatException("Oplog entry has a field of the wrong type: " + e.getMessage(), e);
		}
	}

	private OplogEntry parseFields(BsonDocument doc) {
		BsonTimestamp ts = required(doc, TIMESTAMP).asTimestamp();
		OpType opType;
		try {
			opType = OpType.fromCode(requiredString(doc, OP));
		} catch (IllegalArgumentException e) {
			throw new BsonFormatException("Oplog entry at " + ts + ": " + e.getMessage(), e);
		}
		return new OplogEntry(
			ts,
			opType,
			namespace(doc),
			uuid(doc),
			required(doc, OBJECT).asDocument(),
			optional(doc, OBJECT_2).map(BsonValue::asDocument),
			optional(doc, FROM_MIGRATE).map(v -> v.asBoolean().getValue()).orElse(false));
	}

	/**
	 * Some noops have an empty namespace.
	 */
	private static Optional<Namespace> namespace(BsonDocument doc) {
		Optional<String> ns = optional(doc, NAMESPACE).map(v -> v.asString().getValue());
		if (ns.isEmpty() || ns.get().isEmpty()) {
			return Optional.empty();
		}
		try {
			return Optional.of(Namespace.parse(ns.get()));
		} catch (IllegalArgumentException e) {
			throw new BsonFormatException("Malformed oplog namespace \"" + ns.get() + "\"", e);
		}
	}

	private static Optional<UUID> uuid(BsonDocument doc) {
		Optional<BsonValue> value = optional(doc, UUID_FIELD);
		if (value.isEmpty()) {
			return Optional.empty();
		}
		BsonBinary binary = value.get().asBinary();
		if (binary.getType() != BsonBinarySubType.UUID_STANDARD.getValue()) {
			throw new BsonFormatException("Unexpected binary subtype " + binary.getType() + " for oplog field " + UUID_FIELD);
		}
		return Optional.of(binary.asUuid());
	}

	private static Optional<BsonValue> optional(BsonDocument doc, String field) {
		return Optional.ofNullable(doc.get(field));
	}

	private static BsonValue required(BsonDocument doc, String field) {
		BsonValue result = doc.get(field);
		if (result == null) {
			throw new BsonFormatException("Oplog entry is missing required field \"" + field + "\"");
		}
		return result;
	}

	private static String requiredString(BsonDocument doc, String field) {
		BsonValue value = required(doc, field);
		if (!value.isString()) {
			throw new BsonFormatException("Oplog field \"" + field + "\" must be a string; got " + value.getBsonType());
		}
		return value.asString().getValue();
	}
}
