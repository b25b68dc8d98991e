package io.vena.changestream.mongo;

import io.vena.changestream.Namespace;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class MongoChangeStreamSettings {
	/**
	 * How long the server holds a tailing read open waiting for new oplog entries
	 * before reporting that there are none yet.
	 */
	@Default long maxAwaitTimeMS = 1_000;

	@Default Namespace oplogNamespace = new Namespace("local", "oplog.rs");

	/**
	 * Appears in log messages.
	 */
	@Default String streamName = "changeStream";
}
