package io.vena.changestream.stages;

import io.vena.changestream.ChangeEvent;
import io.vena.changestream.GetNextResult;
import io.vena.changestream.OperationType;
import io.vena.changestream.PostImageLookup;
import io.vena.changestream.Source;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Fills in {@link ChangeEvent#fullDocument() fullDocument} for update events
 * with the document as it is now, which may reflect later changes than the event itself.
 */
public final class PostImageLookupStage implements Stage<ChangeEvent> {
	private final Source<ChangeEvent> upstream;
	private final PostImageLookup lookup;

	public PostImageLookupStage(Source<ChangeEvent> upstream, PostImageLookup lookup) {
		this.upstream = requireNonNull(upstream);
		this.lookup = requireNonNull(lookup);
	}

	@Override
	public GetNextResult<ChangeEvent> getNext() {
		GetNextResult<ChangeEvent> result = upstream.getNext();
		if (result.isAdvanced() && result.value().operationType() == OperationType.UPDATE) {
			ChangeEvent event = result.value();
			BsonValue postImage = lookup.lookup(
					event.ns().get(),
					event.id().toData().uuid(),
					event.documentKey().get())
				.<BsonValue>map(BsonDocument::clone)
				.orElse(BsonNull.VALUE);
			if (postImage.isNull()) {
				LOGGER.debug("No current document for {} in {}", event.documentKey().get(), event.ns().get());
			}
			return GetNextResult.advanced(event.withFullDocument(postImage));
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PostImageLookupStage.class);
}
