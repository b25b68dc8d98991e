package io.vena.changestream;

import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Which namespaces a change stream reports on.
 */
public sealed interface ChangeStreamScope {
	Set<String> INTERNAL_DATABASES = Set.of("admin", "config", "local");

	boolean containsCollection(Namespace ns);

	/**
	 * @return true if dropping the database <code>db</code> ends this stream
	 */
	boolean containsDatabase(String db);

	static ChangeStreamScope collection(Namespace ns) {
		return new Collection(ns);
	}

	static ChangeStreamScope database(String db) {
		return new Database(db);
	}

	static ChangeStreamScope cluster() {
		return new Cluster();
	}

	/**
	 * Convenience for optional namespaces, which never match.
	 */
	default boolean containsCollection(Optional<Namespace> ns) {
		return ns.isPresent() && containsCollection(ns.get());
	}

	record Collection(Namespace ns) implements ChangeStreamScope {
		public Collection {
			requireNonNull(ns);
			if (ns.isCommand()) {
				throw new IllegalArgumentException("Can't watch a command namespace: " + ns);
			}
		}

		@Override
		public boolean containsCollection(Namespace candidate) {
			return ns.equals(candidate);
		}

		@Override
		public boolean containsDatabase(String db) {
			return ns.db().equals(db);
		}

		@Override
		public String toString() {
			return ns.fullName();
		}
	}

	/**
	 * Every user collection of one database; <code>system.*</code> collections are excluded.
	 */
	record Database(String db) implements ChangeStreamScope {
		public Database {
			requireNonNull(db);
		}

		@Override
		public boolean containsCollection(Namespace candidate) {
			return db.equals(candidate.db()) && !candidate.isSystem() && !candidate.isCommand();
		}

		@Override
		public boolean containsDatabase(String candidate) {
			return db.equals(candidate);
		}

		@Override
		public String toString() {
			return db + ".*";
		}
	}

	/**
	 * Every user collection of every user database.
	 */
	record Cluster() implements ChangeStreamScope {
		@Override
		public boolean containsCollection(Namespace candidate) {
			return containsDatabase(candidate.db()) && !candidate.isSystem() && !candidate.isCommand();
		}

		@Override
		public boolean containsDatabase(String db) {
			return !INTERNAL_DATABASES.contains(db);
		}

		@Override
		public String toString() {
			return "*.*";
		}
	}
}
