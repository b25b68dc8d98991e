package io.vena.changestream.stages;

import java.util.List;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonValue;

/**
 * Projects document keys out of oplog documents.
 */
final class DocumentKeys {
	private DocumentKeys() { }

	/**
	 * @param fields in the order they should appear in the result; dotted paths reach into subdocuments
	 * @return a copy of the named fields that are present, or of the whole <code>source</code> if none are.
	 * Documents written before a collection had an <code>_id</code> index may lack it entirely,
	 * and for those the document itself is the best key we have.
	 */
	static BsonDocument project(BsonDocument source, List<String> fields) {
		BsonDocument result = new BsonDocument();
		for (String field: fields) {
			lookup(source, field).ifPresent(v -> result.append(field, v));
		}
		if (result.isEmpty()) {
			return source.clone();
		} else {
			return result.clone();
		}
	}

	static Optional<BsonValue> lookup(BsonDocument source, String path) {
		BsonValue current = source;
		for (String segment: path.split("\\.", -1)) {
			if (current.isDocument() && current.asDocument().containsKey(segment)) {
				current = current.asDocument().get(segment);
			} else {
				return Optional.empty();
			}
		}
		return Optional.of(current);
	}
}
