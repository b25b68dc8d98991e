package io.vena.changestream;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything a {@link ChangeStreamPipeline} needs besides its stage specification.
 */
@Value
@Builder
public class ChangeStreamContext {
	@NonNull ChangeStreamScope scope;
	@NonNull Source<OplogEntry> oplog;
	@Default DocumentKeyResolver documentKeyResolver = DocumentKeyResolver.idOnly();

	/**
	 * Null if the server isn't part of a replica set, in which case no stream can be opened.
	 */
	ReplicationTopology replicationTopology;

	/**
	 * Null if documents can't be looked up, in which case <code>fullDocument: "updateLookup"</code> is rejected.
	 */
	PostImageLookup postImageLookup;

	/**
	 * Appears in log messages.
	 */
	@Default String streamName = "changeStream";
}
