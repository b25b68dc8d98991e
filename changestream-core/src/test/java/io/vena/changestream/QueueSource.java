package io.vena.changestream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Replays a fixed list of values, then answers {@link GetNextResult.Paused}
 * (or {@link GetNextResult.Closed} once {@link #exhaust()} is called)
 * the way a tailing cursor would.
 */
public class QueueSource<T> implements Source<T> {
	private final Deque<T> queue = new ArrayDeque<>();
	private boolean exhausted = false;
	private int pulls = 0;

	@SafeVarargs
	public QueueSource(T... values) {
		queue.addAll(List.of(values));
	}

	public QueueSource<T> add(T value) {
		queue.add(value);
		return this;
	}

	public QueueSource<T> exhaust() {
		exhausted = true;
		return this;
	}

	public int pulls() {
		return pulls;
	}

	@Override
	public GetNextResult<T> getNext() {
		pulls++;
		if (!queue.isEmpty()) {
			return GetNextResult.advanced(queue.removeFirst());
		} else if (exhausted) {
			return GetNextResult.closed(CloseReason.SOURCE_EXHAUSTED);
		} else {
			return GetNextResult.paused();
		}
	}
}
