package io.vena.changestream.mongo;

import io.vena.changestream.ChangeEvent;
import io.vena.changestream.ChangeStreamPipeline;
import io.vena.changestream.GetNextResult;
import io.vena.changestream.Source;
import java.io.Closeable;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A {@link ChangeStreamPipeline} reading from a live oplog.
 * Call {@link #close()} to release the server cursor.
 */
@RequiredArgsConstructor
public final class MongoChangeStream implements Source<ChangeEvent>, Closeable {
	@Getter private final ChangeStreamPipeline pipeline;
	private final MongoOplogSource oplogSource;

	@Override
	public GetNextResult<ChangeEvent> getNext() {
		return pipeline.getNext();
	}

	@Override
	public void close() {
		oplogSource.close();
	}
}
