package io.vena.changestream;

import java.util.Optional;
import java.util.UUID;
import org.bson.BsonDocument;

/**
 * Fetches the current version of a document, for streams opened with
 * {@link FullDocumentMode#UPDATE_LOOKUP}.
 */
public interface PostImageLookup {
	/**
	 * @param collectionUuid the collection the event came from, if known; implementations may use it to
	 *                       avoid reading from a different collection that has since taken the same name
	 * @return empty if no document currently matches <code>documentKey</code>
	 */
	Optional<BsonDocument> lookup(Namespace ns, Optional<UUID> collectionUuid, BsonDocument documentKey);
}
