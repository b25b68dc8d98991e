package io.vena.changestream;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The <code>operationType</code> of a {@link ChangeEvent}.
 */
@Getter
@RequiredArgsConstructor
public enum OperationType {
	INSERT("insert"),
	UPDATE("update"),
	REPLACE("replace"),
	DELETE("delete"),

	/**
	 * The watched scope no longer validly exists. Always the last event of a stream.
	 */
	INVALIDATE("invalidate"),

	/**
	 * An internal topology change requires the client to resume on a new stream.
	 * Always the last event of a stream.
	 */
	RETRY_NEEDED("retryNeeded"),
	;

	private final String value;

	public boolean isTerminal() {
		return this == INVALIDATE || this == RETRY_NEEDED;
	}

	public boolean carriesDocument() {
		return this == INSERT || this == UPDATE || this == REPLACE || this == DELETE;
	}

	@Override
	public String toString() {
		return value;
	}
}
