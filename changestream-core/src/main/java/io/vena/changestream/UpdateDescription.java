package io.vena.changestream;

import java.util.List;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;

import static java.util.Objects.requireNonNull;

/**
 * What an <code>update</code> event changed.
 * Both parts are always present, possibly empty.
 *
 * @param removedFields in the order the update named them
 */
public record UpdateDescription(
	BsonDocument updatedFields,
	List<String> removedFields
) {
	public UpdateDescription {
		requireNonNull(updatedFields);
		removedFields = List.copyOf(removedFields);
	}

	public BsonDocument toBsonDocument() {
		BsonArray removed = new BsonArray();
		removedFields.forEach(f -> removed.add(new BsonString(f)));
		return new BsonDocument()
			.append("updatedFields", updatedFields)
			.append("removedFields", removed);
	}
}
