package io.vena.changestream;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of one {@link Source#getNext() pull}.
 *
 * <ul><li>
 *     {@link Advanced}: here is the next value.
 * </li><li>
 *     {@link Paused}: nothing available right now; pull again later. Not an error.
 * </li><li>
 *     {@link Closed}: the stream can't validly continue. Every later pull gives the same answer.
 *     Stages layered on top must pass this along rather than treat it like an ordinary filtered-out value.
 * </li></ul>
 */
public sealed interface GetNextResult<T> {

	record Advanced<T>(T value) implements GetNextResult<T> {
		public Advanced {
			requireNonNull(value);
		}
	}

	record Paused<T>() implements GetNextResult<T> { }

	record Closed<T>(CloseReason reason) implements GetNextResult<T> {
		public Closed {
			requireNonNull(reason);
		}
	}

	static <T> GetNextResult<T> advanced(T value) {
		return new Advanced<>(value);
	}

	static <T> GetNextResult<T> paused() {
		return new Paused<>();
	}

	static <T> GetNextResult<T> closed(CloseReason reason) {
		return new Closed<>(reason);
	}

	default boolean isAdvanced() {
		return this instanceof Advanced;
	}

	default boolean isPaused() {
		return this instanceof Paused;
	}

	default boolean isClosed() {
		return this instanceof Closed;
	}

	/**
	 * @throws IllegalStateException if this is not {@link Advanced}
	 */
	default T value() {
		if (this instanceof Advanced<T> a) {
			return a.value();
		} else {
			throw new IllegalStateException("No value: " + this);
		}
	}

	/**
	 * Passes a {@link Paused} or {@link Closed} result through a stage whose output type differs from its input type.
	 *
	 * @throws IllegalStateException if this is {@link Advanced}, which always needs stage-specific handling
	 */
	default <U> GetNextResult<U> propagate() {
		if (this instanceof Closed<T> c) {
			return closed(c.reason());
		} else if (this instanceof Paused) {
			return paused();
		} else {
			throw new IllegalStateException("Advanced results can't be propagated as-is: " + this);
		}
	}
}
