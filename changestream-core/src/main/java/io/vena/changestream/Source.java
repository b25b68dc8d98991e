package io.vena.changestream;

/**
 * Something that can be pulled from, one value at a time.
 * Implementations are used by a single consumer and need not be thread-safe.
 */
public interface Source<T> {
	GetNextResult<T> getNext();
}
