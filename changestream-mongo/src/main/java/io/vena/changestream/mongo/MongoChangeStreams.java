package io.vena.changestream.mongo;

import com.mongodb.client.MongoClient;
import io.vena.changestream.ChangeStreamConfigurationException;
import io.vena.changestream.ChangeStreamContext;
import io.vena.changestream.ChangeStreamPipeline;
import io.vena.changestream.ChangeStreamScope;
import io.vena.changestream.ChangeStreamSpec;
import io.vena.changestream.ReplicationTopology;
import io.vena.changestream.mongo.status.OplogWindow;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.mongodb.client.model.Sorts.ascending;
import static com.mongodb.client.model.Sorts.descending;
import static io.vena.changestream.ErrorCode.REPLICATION_REQUIRED;

/**
 * Opens change streams against a MongoDB replica set.
 */
public final class MongoChangeStreams {
	private final MongoClient client;
	private final MongoChangeStreamSettings settings;

	public MongoChangeStreams(MongoClient client, MongoChangeStreamSettings settings) {
		this.client = client;
		this.settings = settings;
	}

	/**
	 * @param stageSpec a document of the form <code>{$changeStream: {...}}</code>
	 * @throws ChangeStreamConfigurationException if the stream can't be opened as specified
	 */
	public MongoChangeStream open(ChangeStreamScope scope, BsonDocument stageSpec) {
		ReplicationTopology topology = MongoReplicationTopology.detect(client)
			.orElseThrow(() -> new ChangeStreamConfigurationException(REPLICATION_REQUIRED,
				"Change streams are only supported on replica sets"));
		ChangeStreamSpec spec = ChangeStreamSpec.parse(stageSpec);

		// Read the start time once so the oplog cursor and the pipeline agree on it
		BsonTimestamp startAt = spec.resumePosition().orElseGet(topology::lastAppliedOpTime);
		ReplicationTopology pinned = () -> startAt;

		MongoOplogSource source = new MongoOplogSource(client, settings, startAt);
		ChangeStreamPipeline pipeline = ChangeStreamPipeline.create(stageSpec, ChangeStreamContext.builder()
			.scope(scope)
			.oplog(source)
			.documentKeyResolver(new ShardKeyDocumentKeyResolver(client))
			.replicationTopology(pinned)
			.postImageLookup(new MongoPostImageLookup(client))
			.streamName(settings.streamName())
			.build());
		return new MongoChangeStream(pipeline, source);
	}

	/**
	 * @return the range of times a stream can currently resume from
	 */
	public OplogWindow oplogWindow() {
		var oplog = client
			.getDatabase(settings.oplogNamespace().db())
			.getCollection(settings.oplogNamespace().coll(), BsonDocument.class);
		Optional<BsonTimestamp> first = Optional.ofNullable(oplog.find().sort(ascending("$natural")).first())
			.map(d -> d.getTimestamp(OplogEntryParser.TIMESTAMP));
		Optional<BsonTimestamp> last = Optional.ofNullable(oplog.find().sort(descending("$natural")).first())
			.map(d -> d.getTimestamp(OplogEntryParser.TIMESTAMP));
		if (first.isEmpty() || last.isEmpty()) {
			LOGGER.warn("Oplog {} is empty or missing; no change stream can resume", settings.oplogNamespace());
			return OplogWindow.unavailable("Oplog " + settings.oplogNamespace() + " is empty or missing");
		}
		return OplogWindow.of(first.get(), last.get());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoChangeStreams.class);
}
