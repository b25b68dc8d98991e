package io.vena.changestream.token;

/**
 * Indicates that a value offered as a {@link ResumeToken} could not have been produced by this codec.
 */
public class MalformedResumeTokenException extends IllegalArgumentException {
	public MalformedResumeTokenException(String s) {
		super(s);
	}

	public MalformedResumeTokenException(String message, Throwable cause) {
		super(message, cause);
	}

	public MalformedResumeTokenException(Throwable cause) {
		super(cause);
	}
}
