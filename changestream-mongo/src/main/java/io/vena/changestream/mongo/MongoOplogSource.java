package io.vena.changestream.mongo;

import com.mongodb.CursorType;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import io.vena.changestream.CloseReason;
import io.vena.changestream.GetNextResult;
import io.vena.changestream.OplogEntry;
import io.vena.changestream.Source;
import java.io.Closeable;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.mongodb.client.model.Filters.gte;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Tails the oplog from a given time onward.
 *
 * <p>
 * The server cursor is opened on the first pull and released by {@link #close()}.
 * A pull that finds nothing new within {@link MongoChangeStreamSettings#maxAwaitTimeMS()}
 * answers {@link GetNextResult.Paused}; once the server cursor is gone
 * (for example, because the oplog rolled over past its position) every pull answers
 * {@link GetNextResult.Closed} with {@link CloseReason#SOURCE_EXHAUSTED}.
 */
public class MongoOplogSource implements Source<OplogEntry>, Closeable {
	private final MongoCollection<BsonDocument> oplog;
	private final MongoChangeStreamSettings settings;
	private final BsonTimestamp startAt;
	private final OplogEntryParser parser = new OplogEntryParser();
	private MongoCursor<BsonDocument> cursor = null;
	private boolean isClosed = false;

	/**
	 * @param startAt the earliest entry to read, inclusive
	 */
	public MongoOplogSource(MongoClient client, MongoChangeStreamSettings settings, BsonTimestamp startAt) {
		this.settings = requireNonNull(settings);
		this.startAt = requireNonNull(startAt);
		this.oplog = client
			.getDatabase(settings.oplogNamespace().db())
			.getCollection(settings.oplogNamespace().coll(), BsonDocument.class);
	}

	@Override
	public GetNextResult<OplogEntry> getNext() {
		if (isClosed) {
			return GetNextResult.closed(CloseReason.SOURCE_EXHAUSTED);
		}
		BsonDocument doc;
		try {
			if (cursor == null) {
				cursor = openCursor();
			}
			doc = cursor.tryNext();
		} catch (MongoException e) {
			LOGGER.warn("Unable to read from the MongoDB oplog; closing change stream", e);
			close();
			return GetNextResult.closed(CloseReason.SOURCE_EXHAUSTED);
		}
		if (doc != null) {
			OplogEntry entry = parser.parse(doc);
			LOGGER.trace("Read {}", entry);
			return GetNextResult.advanced(entry);
		} else if (cursor.getServerCursor() == null) {
			LOGGER.info("Oplog cursor is no longer open on the server; closing change stream");
			close();
			return GetNextResult.closed(CloseReason.SOURCE_EXHAUSTED);
		} else {
			return GetNextResult.paused();
		}
	}

	@Override
	public void close() {
		isClosed = true;
		if (cursor != null) {
			LOGGER.debug("Closing oplog cursor");
			cursor.close();
		}
	}

	private MongoCursor<BsonDocument> openCursor() {
		LOGGER.debug("Opening oplog cursor on {} at {}:{}", settings.oplogNamespace(), startAt.getTime(), startAt.getInc());
		return oplog
			.find(gte(OplogEntryParser.TIMESTAMP, startAt))
			.cursorType(CursorType.TailableAwait)
			.noCursorTimeout(true)
			.maxAwaitTime(settings.maxAwaitTimeMS(), MILLISECONDS)
			.iterator();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoOplogSource.class);
}
