package io.vena.changestream.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import io.vena.changestream.Namespace;
import io.vena.changestream.PostImageLookup;
import java.util.Optional;
import java.util.UUID;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the current version of a document from its collection.
 *
 * <p>
 * If the event names a collection uuid and the collection now found under that name has a different one,
 * the source collection is gone and there is no post-image.
 */
public final class MongoPostImageLookup implements PostImageLookup {
	private final MongoClient client;

	public MongoPostImageLookup(MongoClient client) {
		this.client = client;
	}

	@Override
	public Optional<BsonDocument> lookup(Namespace ns, Optional<UUID> collectionUuid, BsonDocument documentKey) {
		MongoDatabase database = client.getDatabase(ns.db());
		if (collectionUuid.isPresent() && !collectionUuid.equals(currentUuid(database, ns.coll()))) {
			LOGGER.debug("Collection {} no longer has uuid {}", ns, collectionUuid.get());
			return Optional.empty();
		}
		return Optional.ofNullable(database
			.getCollection(ns.coll(), BsonDocument.class)
			.find(documentKey)
			.first());
	}

	private static Optional<UUID> currentUuid(MongoDatabase database, String collectionName) {
		BsonDocument info = database
			.listCollections(BsonDocument.class)
			.filter(new BsonDocument("name", new BsonString(collectionName)))
			.first();
		if (info == null || !info.isDocument("info")) {
			return Optional.empty();
		}
		BsonValue uuid = info.getDocument("info").get("uuid");
		if (uuid != null && uuid.isBinary()) {
			return Optional.of(uuid.asBinary().asUuid());
		} else {
			return Optional.empty();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoPostImageLookup.class);
}
