package io.vena.changestream;

import io.vena.changestream.token.MalformedResumeTokenException;
import io.vena.changestream.token.ResumeToken;
import java.util.Map;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;

import static io.vena.changestream.ErrorCode.CONFLICTING_RESUME_OPTIONS;
import static io.vena.changestream.ErrorCode.FAILED_TO_PARSE;
import static io.vena.changestream.ErrorCode.TYPE_MISMATCH;
import static io.vena.changestream.ErrorCode.UNKNOWN_OPTION;
import static io.vena.changestream.ErrorCode.UNRECOGNIZED_FULL_DOCUMENT_OPTION;
import static java.util.Objects.requireNonNull;

/**
 * The parsed form of a <code>{$changeStream: {...}}</code> stage document.
 *
 * @param options the options exactly as the client gave them, so the stage can be serialized back unchanged
 */
public record ChangeStreamSpec(
	Optional<FullDocumentMode> fullDocument,
	Optional<ResumeToken> resumeAfter,
	Optional<BsonTimestamp> startAtOperationTime,
	BsonDocument options
) {
	public static final String STAGE_NAME = "$changeStream";
	public static final String FULL_DOCUMENT = "fullDocument";
	public static final String RESUME_AFTER = "resumeAfter";
	public static final String START_AT_OPERATION_TIME = "startAtOperationTime";

	public ChangeStreamSpec {
		requireNonNull(fullDocument);
		requireNonNull(resumeAfter);
		requireNonNull(startAtOperationTime);
		options = options.clone();
	}

	@Override
	public BsonDocument options() {
		return options.clone();
	}

	public FullDocumentMode fullDocumentMode() {
		return fullDocument.orElse(FullDocumentMode.DEFAULT);
	}

	public boolean isResuming() {
		return resumeAfter.isPresent() || startAtOperationTime.isPresent();
	}

	/**
	 * @return the earliest oplog time a resuming stream must read, inclusive;
	 * empty for a fresh stream, which starts after the last applied operation instead
	 */
	public Optional<BsonTimestamp> resumePosition() {
		if (resumeAfter.isPresent()) {
			return Optional.of(resumeAfter.get().clusterTime());
		} else {
			return startAtOperationTime;
		}
	}

	/**
	 * @throws ChangeStreamConfigurationException if <code>stageSpec</code> is not a valid stage document
	 */
	public static ChangeStreamSpec parse(BsonValue stageSpec) {
		if (!stageSpec.isDocument()) {
			throw new ChangeStreamConfigurationException(FAILED_TO_PARSE, "Stage specification must be a document; got " + stageSpec.getBsonType());
		}
		BsonDocument stage = stageSpec.asDocument();
		if (stage.size() != 1 || !stage.containsKey(STAGE_NAME)) {
			throw new ChangeStreamConfigurationException(FAILED_TO_PARSE, "Stage specification must have the single field " + STAGE_NAME + "; got " + stage.keySet());
		}
		BsonValue optionsValue = stage.get(STAGE_NAME);
		if (!optionsValue.isDocument()) {
			throw new ChangeStreamConfigurationException(TYPE_MISMATCH, STAGE_NAME + " options must be a document; got " + optionsValue.getBsonType());
		}
		BsonDocument options = optionsValue.asDocument();

		Optional<FullDocumentMode> fullDocument = Optional.empty();
		Optional<ResumeToken> resumeAfter = Optional.empty();
		Optional<BsonTimestamp> startAtOperationTime = Optional.empty();
		for (Map.Entry<String, BsonValue> option: options.entrySet()) {
			BsonValue value = option.getValue();
			switch (option.getKey()) {
				case FULL_DOCUMENT -> {
					if (!value.isString()) {
						throw typeMismatch(FULL_DOCUMENT, "string", value);
					}
					String modeName = value.asString().getValue();
					fullDocument = Optional.of(FullDocumentMode.fromOptionValue(modeName)
						.orElseThrow(() -> new ChangeStreamConfigurationException(UNRECOGNIZED_FULL_DOCUMENT_OPTION,
							"Unrecognized value for " + FULL_DOCUMENT + " option: \"" + modeName + "\"")));
				}
				case RESUME_AFTER -> {
					if (!value.isDocument()) {
						throw typeMismatch(RESUME_AFTER, "document", value);
					}
					try {
						resumeAfter = Optional.of(ResumeToken.parse(value));
					} catch (MalformedResumeTokenException e) {
						throw new ChangeStreamConfigurationException(FAILED_TO_PARSE, "Invalid " + RESUME_AFTER + " token: " + e.getMessage(), e);
					}
				}
				case START_AT_OPERATION_TIME -> {
					if (!value.isTimestamp()) {
						throw typeMismatch(START_AT_OPERATION_TIME, "timestamp", value);
					}
					startAtOperationTime = Optional.of(value.asTimestamp());
				}
				default -> throw new ChangeStreamConfigurationException(UNKNOWN_OPTION,
					"Unrecognized option to " + STAGE_NAME + " stage: \"" + option.getKey() + "\"");
			}
		}
		if (resumeAfter.isPresent() && startAtOperationTime.isPresent()) {
			throw new ChangeStreamConfigurationException(CONFLICTING_RESUME_OPTIONS,
				"Only one of " + RESUME_AFTER + " and " + START_AT_OPERATION_TIME + " can be specified");
		}
		return new ChangeStreamSpec(fullDocument, resumeAfter, startAtOperationTime, options);
	}

	public BsonDocument toBsonDocument() {
		return new BsonDocument(STAGE_NAME, options.clone());
	}

	private static ChangeStreamConfigurationException typeMismatch(String option, String expected, BsonValue actual) {
		return new ChangeStreamConfigurationException(TYPE_MISMATCH,
			"Option " + option + " must be a " + expected + "; got " + actual.getBsonType());
	}
}
