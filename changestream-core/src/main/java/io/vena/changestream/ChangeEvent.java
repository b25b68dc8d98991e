package io.vena.changestream;

import io.vena.changestream.token.ResumeToken;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;

import static java.util.Objects.requireNonNull;

/**
 * The unit a change stream client receives.
 *
 * <p>
 * Which optional parts are present is fully determined by {@link #operationType()};
 * the constructor rejects any other combination.
 * Events that don't concern a document ({@link OperationType#isTerminal() terminal} events)
 * carry nothing but their {@link #id()} and {@link #operationType()}.
 *
 * @param id where a new stream should resume to see the events after this one
 * @param fullDocument for inserts and replaces, the new document. For updates, present only when
 *                     the stream looks up post-images, in which case it's the current document or
 *                     {@link org.bson.BsonNull BsonNull} if there isn't one.
 */
public record ChangeEvent(
	ResumeToken id,
	OperationType operationType,
	Optional<Namespace> ns,
	Optional<BsonDocument> documentKey,
	Optional<BsonValue> fullDocument,
	Optional<UpdateDescription> updateDescription
) {
	public ChangeEvent {
		requireNonNull(id);
		requireNonNull(operationType);
		requireNonNull(ns);
		requireNonNull(documentKey);
		requireNonNull(fullDocument);
		requireNonNull(updateDescription);
		if (operationType.carriesDocument()) {
			require(operationType, ns.isPresent(), "namespace");
			require(operationType, documentKey.isPresent(), "documentKey");
		} else {
			forbid(operationType, ns.isPresent(), "namespace");
			forbid(operationType, documentKey.isPresent(), "documentKey");
		}
		switch (operationType) {
			case INSERT, REPLACE -> {
				require(operationType, fullDocument.isPresent() && fullDocument.get().isDocument(), "fullDocument");
				forbid(operationType, updateDescription.isPresent(), "updateDescription");
			}
			case UPDATE -> {
				require(operationType, updateDescription.isPresent(), "updateDescription");
				fullDocument.ifPresent(d -> require(operationType, d.isDocument() || d.isNull(), "fullDocument document or null"));
			}
			case DELETE, INVALIDATE, RETRY_NEEDED -> {
				forbid(operationType, fullDocument.isPresent(), "fullDocument");
				forbid(operationType, updateDescription.isPresent(), "updateDescription");
			}
		}
	}

	private static void require(OperationType operationType, boolean condition, String what) {
		if (!condition) {
			throw new IllegalArgumentException(operationType + " event requires " + what);
		}
	}

	private static void forbid(OperationType operationType, boolean condition, String what) {
		if (condition) {
			throw new IllegalArgumentException(operationType + " event can't have " + what);
		}
	}

	public static ChangeEvent insert(ResumeToken id, Namespace ns, BsonDocument documentKey, BsonDocument fullDocument) {
		return new ChangeEvent(id, OperationType.INSERT, Optional.of(ns), Optional.of(documentKey), Optional.of(fullDocument), Optional.empty());
	}

	public static ChangeEvent update(ResumeToken id, Namespace ns, BsonDocument documentKey, UpdateDescription updateDescription) {
		return new ChangeEvent(id, OperationType.UPDATE, Optional.of(ns), Optional.of(documentKey), Optional.empty(), Optional.of(updateDescription));
	}

	public static ChangeEvent replace(ResumeToken id, Namespace ns, BsonDocument documentKey, BsonDocument fullDocument) {
		return new ChangeEvent(id, OperationType.REPLACE, Optional.of(ns), Optional.of(documentKey), Optional.of(fullDocument), Optional.empty());
	}

	public static ChangeEvent delete(ResumeToken id, Namespace ns, BsonDocument documentKey) {
		return new ChangeEvent(id, OperationType.DELETE, Optional.of(ns), Optional.of(documentKey), Optional.empty(), Optional.empty());
	}

	public static ChangeEvent invalidate(ResumeToken id) {
		return terminal(id, OperationType.INVALIDATE);
	}

	public static ChangeEvent retryNeeded(ResumeToken id) {
		return terminal(id, OperationType.RETRY_NEEDED);
	}

	private static ChangeEvent terminal(ResumeToken id, OperationType operationType) {
		return new ChangeEvent(id, operationType, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
	}

	/**
	 * @param postImage the current document, or {@link org.bson.BsonNull BsonNull}
	 */
	public ChangeEvent withFullDocument(BsonValue postImage) {
		return new ChangeEvent(id, operationType, ns, documentKey, Optional.of(postImage), updateDescription);
	}

	/**
	 * The event as the client sees it.
	 */
	public BsonDocument toBsonDocument() {
		BsonDocument result = new BsonDocument()
			.append(ID_FIELD, id.toBsonDocument())
			.append(OPERATION_TYPE_FIELD, new BsonString(operationType.value()));
		fullDocument.ifPresent(d -> result.append(FULL_DOCUMENT_FIELD, d));
		ns.ifPresent(n -> result.append(NAMESPACE_FIELD, n.toBsonDocument()));
		documentKey.ifPresent(k -> result.append(DOCUMENT_KEY_FIELD, k));
		updateDescription.ifPresent(u -> result.append(UPDATE_DESCRIPTION_FIELD, u.toBsonDocument()));
		return result;
	}

	public static final String ID_FIELD = "_id";
	public static final String OPERATION_TYPE_FIELD = "operationType";
	public static final String FULL_DOCUMENT_FIELD = "fullDocument";
	public static final String NAMESPACE_FIELD = "ns";
	public static final String DOCUMENT_KEY_FIELD = "documentKey";
	public static final String UPDATE_DESCRIPTION_FIELD = "updateDescription";
}
