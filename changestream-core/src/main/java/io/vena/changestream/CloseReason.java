package io.vena.changestream;

/**
 * Why a change stream stopped.
 */
public enum CloseReason {
	/**
	 * An {@link OperationType#INVALIDATE invalidate} event was emitted.
	 */
	INVALIDATED,

	/**
	 * A {@link OperationType#RETRY_NEEDED retryNeeded} event was emitted.
	 * The client should resume from that event's token on a new stream.
	 */
	RETRY_NEEDED,

	/**
	 * The stream was asked to resume after a token that is no longer in the oplog,
	 * so some events may have been lost.
	 */
	RESUME_TOKEN_NOT_FOUND,

	/**
	 * The oplog source can supply no more entries, ever.
	 */
	SOURCE_EXHAUSTED,
}
