package io.vena.changestream;

import java.util.List;
import java.util.UUID;

/**
 * Supplies the fields that uniquely identify a document within a collection.
 *
 * <p>
 * The answer may change over time (for example, when a collection becomes sharded),
 * so callers ask again for every oplog entry instead of remembering it.
 */
public interface DocumentKeyResolver {
	List<String> ID_ONLY = List.of("_id");

	/**
	 * @return field names (possibly dotted paths) in the order they should appear in the document key.
	 * Returns {@link #ID_ONLY} if nothing more specific is known about the collection.
	 */
	List<String> documentKeyFields(UUID collectionUuid);

	static DocumentKeyResolver idOnly() {
		return uuid -> ID_ONLY;
	}
}
