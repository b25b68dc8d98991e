package io.vena.changestream.mongo;

/**
 * A document read from the server, such as an oplog entry or a command reply,
 * doesn't have the shape we expect.
 */
public class BsonFormatException extends IllegalStateException {
	public BsonFormatException(String message) {
		super(message);
	}

	public BsonFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
