package io.vena.changestream;

import io.vena.changestream.MappedDiagnosticContext.MDCScope;
import io.vena.changestream.stages.ChangeEventTransformer;
import io.vena.changestream.stages.CloseCursorStage;
import io.vena.changestream.stages.EnsureResumeTokenPresentStage;
import io.vena.changestream.stages.OplogMatchStage;
import io.vena.changestream.stages.OplogMatcher;
import io.vena.changestream.stages.PostImageLookupStage;
import io.vena.changestream.stages.Stage;
import io.vena.changestream.stages.TransformationStage;
import java.util.ArrayList;
import java.util.List;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static io.vena.changestream.ErrorCode.POST_IMAGE_LOOKUP_UNAVAILABLE;
import static io.vena.changestream.ErrorCode.REPLICATION_REQUIRED;
import static io.vena.changestream.FullDocumentMode.UPDATE_LOOKUP;
import static io.vena.changestream.MappedDiagnosticContext.setupMDC;

/**
 * A change stream: the chain of stages that turns oplog entries into {@link ChangeEvent}s.
 *
 * <p>
 * The chain is always
 * {@link OplogMatchStage} → {@link TransformationStage} → {@link CloseCursorStage},
 * with {@link EnsureResumeTokenPresentStage} before the close-cursor stage when resuming after a token,
 * and {@link PostImageLookupStage} at the end for <code>fullDocument: "updateLookup"</code>.
 *
 * <p>
 * Not thread-safe. Pull with {@link #getNext()} until it returns {@link GetNextResult.Closed}.
 */
public final class ChangeStreamPipeline implements Source<ChangeEvent> {
	private final String streamName;
	private final ChangeStreamSpec spec;
	private final List<Stage<?>> stages;
	private final Stage<ChangeEvent> last;
	private boolean loggedClose = false;

	private ChangeStreamPipeline(String streamName, ChangeStreamSpec spec, List<Stage<?>> stages, Stage<ChangeEvent> last) {
		this.streamName = streamName;
		this.spec = spec;
		this.stages = List.copyOf(stages);
		this.last = last;
	}

	/**
	 * @param stageSpec a document of the form <code>{$changeStream: {...}}</code>
	 * @throws ChangeStreamConfigurationException if the stream can't be opened as specified
	 */
	public static ChangeStreamPipeline create(BsonDocument stageSpec, ChangeStreamContext context) {
		try (MDCScope __ = setupMDC(context.streamName())) {
			ReplicationTopology topology = context.replicationTopology();
			if (topology == null) {
				throw new ChangeStreamConfigurationException(REPLICATION_REQUIRED,
					"Change streams are only supported on replica sets");
			}
			ChangeStreamSpec spec = ChangeStreamSpec.parse(stageSpec);
			if (spec.fullDocumentMode() == UPDATE_LOOKUP && context.postImageLookup() == null) {
				throw new ChangeStreamConfigurationException(POST_IMAGE_LOOKUP_UNAVAILABLE,
					"fullDocument: \"updateLookup\" requires the ability to look up documents");
			}

			BsonTimestamp startAt = spec.resumePosition().orElseGet(topology::lastAppliedOpTime);

			List<Stage<?>> stages = new ArrayList<>();
			OplogMatchStage match = new OplogMatchStage(context.oplog(), new OplogMatcher(context.scope(), startAt, spec.isResuming()));
			stages.add(match);
			Stage<ChangeEvent> last = new TransformationStage(match, new ChangeEventTransformer(context.documentKeyResolver()));
			stages.add(last);
			if (spec.resumeAfter().isPresent()) {
				last = new EnsureResumeTokenPresentStage(last, spec.resumeAfter().get());
				stages.add(last);
			}
			last = new CloseCursorStage(last);
			stages.add(last);
			if (spec.fullDocumentMode() == UPDATE_LOOKUP) {
				last = new PostImageLookupStage(last, context.postImageLookup());
				stages.add(last);
			}
			LOGGER.info("Opening change stream on {} starting {} {}",
				context.scope(),
				spec.isResuming() ? "at" : "after",
				startAt.getTime() + ":" + startAt.getInc());
			return new ChangeStreamPipeline(context.streamName(), spec, stages, last);
		}
	}

	@Override
	public GetNextResult<ChangeEvent> getNext() {
		try (MDCScope __ = setupMDC(streamName)) {
			GetNextResult<ChangeEvent> result = last.getNext();
			if (result instanceof GetNextResult.Advanced<ChangeEvent> advanced) {
				ChangeEvent event = advanced.value();
				MDC.put(MdcKeys.EVENT, event.operationType().value());
				LOGGER.trace("Emitting {}", event.id());
			} else if (result instanceof GetNextResult.Closed<ChangeEvent> closed && !loggedClose) {
				loggedClose = true;
				LOGGER.info("Change stream closed: {}", closed.reason());
			}
			return result;
		}
	}

	public ChangeStreamSpec spec() {
		return spec;
	}

	/**
	 * @return the stages in the order data flows through them
	 */
	public List<Stage<?>> stages() {
		return stages;
	}

	/**
	 * @return a stage document list that {@link #create} would turn into an equivalent pipeline
	 */
	public List<BsonDocument> serialize() {
		return List.of(spec.toBsonDocument());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ChangeStreamPipeline.class);
}
