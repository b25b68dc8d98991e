package io.vena.changestream.stages;

import io.vena.changestream.ChangeEvent;
import io.vena.changestream.DocumentKeyResolver;
import io.vena.changestream.Namespace;
import io.vena.changestream.OplogEntry;
import io.vena.changestream.token.ResumeToken;
import io.vena.changestream.token.ResumeTokenData;
import java.util.List;
import java.util.Optional;
import org.bson.BsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.changestream.OpType.NOOP;
import static io.vena.changestream.stages.OplogMatcher.DROP;
import static io.vena.changestream.stages.OplogMatcher.DROP_DATABASE;
import static io.vena.changestream.stages.OplogMatcher.RENAME_COLLECTION;
import static io.vena.changestream.stages.OplogMatcher.isMigrationMarker;
import static java.util.Objects.requireNonNull;

/**
 * Converts one oplog entry into the change event a client should see, if any.
 *
 * <p>
 * The document key fields are asked of the {@link DocumentKeyResolver} for every entry,
 * because a collection's shard key can change while a stream is open.
 *
 * <p>
 * Events never share mutable BSON values with the entry or with each other's parts.
 */
public final class ChangeEventTransformer {
	private final DocumentKeyResolver documentKeyResolver;

	public ChangeEventTransformer(DocumentKeyResolver documentKeyResolver) {
		this.documentKeyResolver = requireNonNull(documentKeyResolver);
	}

	public Optional<ChangeEvent> transform(OplogEntry entry) {
		List<String> fields = entry.uuid()
			.map(documentKeyResolver::documentKeyFields)
			.orElse(DocumentKeyResolver.ID_ONLY);
		return transform(entry, fields);
	}

	/**
	 * @param documentKeyFields the order of fields in the resulting event's document key; never reordered
	 * @return empty if the entry doesn't correspond to anything a client should see
	 */
	public Optional<ChangeEvent> transform(OplogEntry entry, List<String> documentKeyFields) {
		if (entry.fromMigrate() && entry.opType() != NOOP) {
			LOGGER.trace("Suppressing migration write {}", entry);
			return Optional.empty();
		}
		return switch (entry.opType()) {
			case INSERT -> crud(entry, ns -> {
				BsonDocument key = DocumentKeys.project(entry.object(), documentKeyFields);
				return ChangeEvent.insert(token(entry, key), ns, key, entry.object().clone());
			});
			case UPDATE -> crud(entry, ns -> {
				if (UpdateDescriptions.isModifierDocument(entry.object())) {
					BsonDocument key = DocumentKeys.project(entry.object2().orElseGet(BsonDocument::new), documentKeyFields);
					return ChangeEvent.update(token(entry, key), ns, key, UpdateDescriptions.fromModifiers(entry.object()));
				} else {
					BsonDocument key = DocumentKeys.project(entry.object2().orElse(entry.object()), documentKeyFields);
					return ChangeEvent.replace(token(entry, key), ns, key, entry.object().clone());
				}
			});
			case DELETE -> crud(entry, ns -> {
				BsonDocument key = DocumentKeys.project(entry.object(), documentKeyFields);
				return ChangeEvent.delete(token(entry, key), ns, key);
			});
			case COMMAND -> command(entry);
			case NOOP -> noop(entry);
		};
	}

	private Optional<ChangeEvent> crud(OplogEntry entry, CrudEventFactory factory) {
		if (entry.namespace().isEmpty()) {
			LOGGER.debug("Suppressing {}: no namespace", entry);
			return Optional.empty();
		}
		return Optional.of(factory.create(entry.namespace().get()));
	}

	private Optional<ChangeEvent> command(OplogEntry entry) {
		BsonDocument command = entry.object();
		if (command.containsKey(DROP_DATABASE)) {
			// The database has no uuid
			return Optional.of(ChangeEvent.invalidate(ResumeToken.fromData(ResumeTokenData.of(entry.timestamp()))));
		} else if (command.containsKey(DROP) || command.containsKey(RENAME_COLLECTION)) {
			return Optional.of(ChangeEvent.invalidate(token(entry, new BsonDocument())));
		} else {
			LOGGER.trace("Suppressing command {}", entry);
			return Optional.empty();
		}
	}

	private Optional<ChangeEvent> noop(OplogEntry entry) {
		if (isMigrationMarker(entry)) {
			BsonDocument key = new BsonDocument(ChangeEvent.ID_FIELD, entry.object2().get());
			return Optional.of(ChangeEvent.retryNeeded(token(entry, key)));
		} else {
			LOGGER.trace("Suppressing noop {}", entry);
			return Optional.empty();
		}
	}

	private static ResumeToken token(OplogEntry entry, BsonDocument documentKey) {
		return ResumeToken.fromData(new ResumeTokenData(entry.timestamp(), entry.uuid(), documentKey));
	}

	@FunctionalInterface
	private interface CrudEventFactory {
		ChangeEvent create(Namespace ns);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventTransformer.class);
}
