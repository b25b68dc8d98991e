package io.vena.changestream.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import io.vena.changestream.DocumentKeyResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.mongodb.client.model.Filters.eq;

/**
 * Looks up shard keys in <code>config.collections</code>.
 * The document key is the shard key fields followed by <code>_id</code>
 * (unless the shard key already includes it).
 *
 * <p>
 * Unsharded collections, and every collection on a plain replica set, use just <code>_id</code>.
 */
public final class ShardKeyDocumentKeyResolver implements DocumentKeyResolver {
	private final MongoCollection<BsonDocument> configCollections;

	public ShardKeyDocumentKeyResolver(MongoClient client) {
		this.configCollections = client
			.getDatabase("config")
			.getCollection("collections", BsonDocument.class);
	}

	@Override
	public List<String> documentKeyFields(UUID collectionUuid) {
		BsonDocument entry = configCollections.find(eq("uuid", new BsonBinary(collectionUuid))).first();
		if (entry == null || entry.getBoolean("dropped", BsonBoolean.FALSE).getValue()) {
			return ID_ONLY;
		}
		BsonValue key = entry.get("key");
		if (key == null || !key.isDocument()) {
			throw new BsonFormatException("Shard key for collection " + collectionUuid + " is not a document: " + entry.toJson());
		}
		List<String> result = new ArrayList<>(key.asDocument().keySet());
		if (!result.contains("_id")) {
			result.add("_id");
		}
		LOGGER.trace("Document key for {} is {}", collectionUuid, result);
		return List.copyOf(result);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ShardKeyDocumentKeyResolver.class);
}
