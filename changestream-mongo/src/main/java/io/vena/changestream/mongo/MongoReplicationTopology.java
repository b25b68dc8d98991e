package io.vena.changestream.mongo;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import io.vena.changestream.ReplicationTopology;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the server about its replica set using the <code>hello</code> command.
 */
public final class MongoReplicationTopology implements ReplicationTopology {
	private final MongoDatabase admin;
	private final String setName;

	private MongoReplicationTopology(MongoDatabase admin, String setName) {
		this.admin = admin;
		this.setName = setName;
	}

	/**
	 * @return empty if the server is not a replica set member
	 */
	public static Optional<ReplicationTopology> detect(MongoClient client) {
		MongoDatabase admin = client.getDatabase("admin");
		BsonDocument reply = hello(admin);
		BsonValue setName = reply.get("setName");
		if (setName == null || !setName.isString()) {
			LOGGER.info("MongoDB server is not a replica set member; change streams are unavailable");
			return Optional.empty();
		}
		LOGGER.debug("Connected to replica set \"{}\"", setName.asString().getValue());
		return Optional.of(new MongoReplicationTopology(admin, setName.asString().getValue()));
	}

	public String setName() {
		return setName;
	}

	@Override
	public BsonTimestamp lastAppliedOpTime() {
		BsonDocument reply = hello(admin);
		try {
			return reply.getDocument("lastWrite").getDocument("opTime").getTimestamp("ts");
		} catch (BsonInvalidOperationException e) {
			throw new BsonFormatException("Unable to read lastWrite.opTime.ts from hello reply: " + reply.toJson(), e);
		}
	}

	private static BsonDocument hello(MongoDatabase admin) {
		return admin.runCommand(new BsonDocument("hello", new BsonInt32(1)), BsonDocument.class);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoReplicationTopology.class);
}
