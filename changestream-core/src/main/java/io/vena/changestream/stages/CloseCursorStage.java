package io.vena.changestream.stages;

import io.vena.changestream.ChangeEvent;
import io.vena.changestream.CloseReason;
import io.vena.changestream.GetNextResult;
import io.vena.changestream.GetNextResult.Closed;
import io.vena.changestream.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.changestream.CloseReason.INVALIDATED;
import static io.vena.changestream.CloseReason.RETRY_NEEDED;
import static java.util.Objects.requireNonNull;

/**
 * Ends the stream after a terminal event.
 *
 * <p>
 * The terminal event itself is passed along, and every later pull answers {@link Closed}.
 * This holds even if a later stage discards the terminal event,
 * so no stage built on top of this one can see events from after an invalidation.
 */
public final class CloseCursorStage implements Stage<ChangeEvent> {
	private final Source<ChangeEvent> upstream;
	private CloseReason closeReason = null;

	public CloseCursorStage(Source<ChangeEvent> upstream) {
		this.upstream = requireNonNull(upstream);
	}

	public boolean isClosed() {
		return closeReason != null;
	}

	@Override
	public GetNextResult<ChangeEvent> getNext() {
		if (closeReason != null) {
			return GetNextResult.closed(closeReason);
		}
		GetNextResult<ChangeEvent> result = upstream.getNext();
		if (result instanceof Closed<ChangeEvent> closed) {
			LOGGER.debug("Upstream closed: {}", closed.reason());
			closeReason = closed.reason();
		} else if (result.isAdvanced() && result.value().operationType().isTerminal()) {
			ChangeEvent event = result.value();
			closeReason = switch (event.operationType()) {
				case INVALIDATE -> INVALIDATED;
				case RETRY_NEEDED -> RETRY_NEEDED;
				default -> throw new AssertionError("Unexpected terminal event: " + event.operationType());
			};
			LOGGER.debug("Closing cursor after {} event {}", event.operationType(), event.id());
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CloseCursorStage.class);
}
