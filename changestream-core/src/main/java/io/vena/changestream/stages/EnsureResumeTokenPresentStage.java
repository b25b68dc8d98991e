package io.vena.changestream.stages;

import io.vena.changestream.ChangeEvent;
import io.vena.changestream.GetNextResult;
import io.vena.changestream.Source;
import io.vena.changestream.token.ResumeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.changestream.CloseReason.RESUME_TOKEN_NOT_FOUND;
import static java.util.Objects.requireNonNull;

/**
 * Skips events up to and including the one a client is resuming after,
 * and closes the stream if that event turns out to be missing.
 *
 * <p>
 * A missing event means the oplog has rolled over past it
 * (or it was never part of this stream), and
 * resuming anyway could silently lose the events in between.
 */
public final class EnsureResumeTokenPresentStage implements Stage<ChangeEvent> {
	private final Source<ChangeEvent> upstream;
	private final ResumeToken resumeAfter;
	private State state = State.SEARCHING;

	private enum State { SEARCHING, FOUND, NOT_FOUND }

	public EnsureResumeTokenPresentStage(Source<ChangeEvent> upstream, ResumeToken resumeAfter) {
		this.upstream = requireNonNull(upstream);
		this.resumeAfter = requireNonNull(resumeAfter);
	}

	@Override
	public GetNextResult<ChangeEvent> getNext() {
		switch (state) {
			case FOUND:
				return upstream.getNext();
			case NOT_FOUND:
				return GetNextResult.closed(RESUME_TOKEN_NOT_FOUND);
		}
		while (true) {
			GetNextResult<ChangeEvent> result = upstream.getNext();
			if (!result.isAdvanced()) {
				return result;
			}
			ChangeEvent event = result.value();
			int comparison = event.id().compareTo(resumeAfter);
			if (comparison < 0) {
				LOGGER.trace("Skipping event before resume point: {}", event.id());
			} else if (comparison == 0) {
				LOGGER.debug("Found resume point {}", resumeAfter);
				state = State.FOUND;
				return upstream.getNext();
			} else {
				LOGGER.warn("Cannot resume change stream: the event with resume token {} is no longer in the oplog. The client must start a new stream and reload its data.", resumeAfter);
				state = State.NOT_FOUND;
				return GetNextResult.closed(RESUME_TOKEN_NOT_FOUND);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EnsureResumeTokenPresentStage.class);
}
