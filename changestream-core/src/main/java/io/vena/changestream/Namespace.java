package io.vena.changestream;

import org.bson.BsonDocument;
import org.bson.BsonString;

import static java.util.Objects.requireNonNull;

/**
 * A database name plus a collection name, written <code>db.coll</code> in the oplog.
 * The collection part may itself contain dots.
 */
public record Namespace(String db, String coll) {
	public static final String COMMAND_COLLECTION = "$cmd";

	public Namespace {
		requireNonNull(db);
		requireNonNull(coll);
		if (db.isEmpty()) {
			throw new IllegalArgumentException("Database name can't be empty");
		} else if (db.contains(".")) {
			throw new IllegalArgumentException("Database name can't contain a dot: \"" + db + "\"");
		}
	}

	/**
	 * @throws IllegalArgumentException if <code>fullName</code> has no dot separating database from collection
	 */
	public static Namespace parse(String fullName) {
		int dot = fullName.indexOf('.');
		if (dot < 0) {
			throw new IllegalArgumentException("Namespace has no collection part: \"" + fullName + "\"");
		}
		return new Namespace(fullName.substring(0, dot), fullName.substring(dot + 1));
	}

	public static Namespace commandNamespace(String db) {
		return new Namespace(db, COMMAND_COLLECTION);
	}

	public boolean isCommand() {
		return COMMAND_COLLECTION.equals(coll);
	}

	public boolean isSystem() {
		return coll.startsWith("system.");
	}

	public String fullName() {
		return db + "." + coll;
	}

	/**
	 * The <code>ns</code> field of a change event.
	 */
	public BsonDocument toBsonDocument() {
		return new BsonDocument()
			.append("db", new BsonString(db))
			.append("coll", new BsonString(coll));
	}

	@Override
	public String toString() {
		return fullName();
	}
}
