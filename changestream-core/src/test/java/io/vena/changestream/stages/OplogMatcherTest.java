package io.vena.changestream.stages;

import io.vena.changestream.ChangeStreamScope;
import io.vena.changestream.Namespace;
import io.vena.changestream.OplogEntry;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static io.vena.changestream.OplogEntries.DB;
import static io.vena.changestream.OplogEntries.NS;
import static io.vena.changestream.OplogEntries.OTHER_NS;
import static io.vena.changestream.OplogEntries.TEST_UUID;
import static io.vena.changestream.OplogEntries.command;
import static io.vena.changestream.OplogEntries.delete;
import static io.vena.changestream.OplogEntries.doc;
import static io.vena.changestream.OplogEntries.drop;
import static io.vena.changestream.OplogEntries.dropDatabase;
import static io.vena.changestream.OplogEntries.insert;
import static io.vena.changestream.OplogEntries.migrationMarker;
import static io.vena.changestream.OplogEntries.newPrimaryNoop;
import static io.vena.changestream.OplogEntries.rename;
import static io.vena.changestream.OplogEntries.ts;
import static io.vena.changestream.OplogEntries.update;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OplogMatcherTest {
	final OplogMatcher collectionMatcher = new OplogMatcher(ChangeStreamScope.collection(NS), ts(100, 0), false);

	@Test
	void crudInCollection_matches() {
		assertTrue(collectionMatcher.test(insert(ts(101, 1), NS, doc("{_id: 1}"))));
		assertTrue(collectionMatcher.test(update(ts(101, 2), NS, doc("{$set: {x: 1}}"), doc("{_id: 1}"))));
		assertTrue(collectionMatcher.test(delete(ts(101, 3), NS, doc("{_id: 1}"))));
	}

	@Test
	void crudInOtherCollection_dropped() {
		assertFalse(collectionMatcher.test(insert(ts(101, 1), OTHER_NS, doc("{_id: 1}"))));
		assertFalse(collectionMatcher.test(insert(ts(101, 1), new Namespace("otherdb", NS.coll()), doc("{_id: 1}"))));
	}

	@Test
	void beforeStart_dropped() {
		assertFalse(collectionMatcher.test(insert(ts(99, 1), NS, doc("{_id: 1}"))));
	}

	@Test
	void exactlyAtStart_dependsOnInclusivity() {
		OplogEntry entry = insert(ts(100, 0), NS, doc("{_id: 1}"));
		assertFalse(collectionMatcher.test(entry));
		assertTrue(new OplogMatcher(ChangeStreamScope.collection(NS), ts(100, 0), true).test(entry));
	}

	@Test
	void fromMigrateWrites_dropped() {
		assertFalse(collectionMatcher.test(insert(ts(101, 1), NS, doc("{_id: 1}")).withFromMigrate(true)));
		assertFalse(collectionMatcher.test(drop(ts(101, 1), NS).withFromMigrate(true)));
	}

	@Test
	void migrationMarker_matchesDespiteFromMigrate() {
		assertTrue(collectionMatcher.test(migrationMarker(ts(101, 1), NS)));
		assertFalse(collectionMatcher.test(migrationMarker(ts(101, 1), OTHER_NS)));
	}

	@Test
	void newPrimaryNoop_dropped() {
		assertFalse(collectionMatcher.test(newPrimaryNoop(ts(101, 1))));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"{create: 'coll', idIndex: {v: 2, key: {_id: 1}, name: '_id_'}}",
		"{createIndexes: 'coll', v: 2, key: {x: 1}, name: 'x_1'}",
		"{dropIndexes: 'coll', index: 'x_1'}",
		"{collMod: 'coll', validator: {}}",
	})
	void nonInvalidatingCommands_dropped(String body) {
		assertFalse(collectionMatcher.test(command(ts(101, 1), DB, Optional.of(TEST_UUID), doc(body))));
	}

	@Test
	void legacyIndexBuild_dropped() {
		Namespace systemIndexes = new Namespace(DB, "system.indexes");
		assertFalse(collectionMatcher.test(insert(ts(101, 1), systemIndexes, doc("{v: 2, key: {x: 1}, name: 'x_1', ns: 'test.coll'}"))));
	}

	@Test
	void dropOfCollection_matches() {
		assertTrue(collectionMatcher.test(drop(ts(101, 1), NS)));
		assertFalse(collectionMatcher.test(drop(ts(101, 1), OTHER_NS)));
	}

	@Test
	void dropDatabase_matchesOnlyOwnDatabase() {
		assertTrue(collectionMatcher.test(dropDatabase(ts(101, 1), DB)));
		assertFalse(collectionMatcher.test(dropDatabase(ts(101, 1), "otherdb")));
	}

	@Test
	void renameEitherDirection_matches() {
		assertTrue(collectionMatcher.test(rename(ts(101, 1), NS, OTHER_NS)));
		assertTrue(collectionMatcher.test(rename(ts(101, 1), OTHER_NS, NS)));
		assertTrue(collectionMatcher.test(rename(ts(101, 1), new Namespace("otherdb", "x"), NS)));
		assertFalse(collectionMatcher.test(rename(ts(101, 1), OTHER_NS, new Namespace(DB, "third"))));
	}

	@Test
	void databaseScope_excludesSystemCollections() {
		OplogMatcher matcher = new OplogMatcher(ChangeStreamScope.database(DB), ts(100, 0), false);
		assertTrue(matcher.test(insert(ts(101, 1), NS, doc("{_id: 1}"))));
		assertTrue(matcher.test(insert(ts(101, 1), OTHER_NS, doc("{_id: 1}"))));
		assertTrue(matcher.test(drop(ts(101, 1), OTHER_NS)));
		assertFalse(matcher.test(insert(ts(101, 1), new Namespace(DB, "system.users"), doc("{_id: 1}"))));
		assertFalse(matcher.test(insert(ts(101, 1), new Namespace("otherdb", "coll"), doc("{_id: 1}"))));
	}

	@Test
	void clusterScope_excludesInternalDatabases() {
		OplogMatcher matcher = new OplogMatcher(ChangeStreamScope.cluster(), ts(100, 0), false);
		assertTrue(matcher.test(insert(ts(101, 1), NS, doc("{_id: 1}"))));
		assertTrue(matcher.test(insert(ts(101, 1), new Namespace("otherdb", "coll"), doc("{_id: 1}"))));
		assertTrue(matcher.test(dropDatabase(ts(101, 1), "otherdb")));
		assertFalse(matcher.test(insert(ts(101, 1), new Namespace("admin", "coll"), doc("{_id: 1}"))));
		assertFalse(matcher.test(insert(ts(101, 1), new Namespace("config", "chunks"), doc("{_id: 1}"))));
		assertFalse(matcher.test(dropDatabase(ts(101, 1), "local")));
	}
}
