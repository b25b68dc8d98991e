package io.vena.changestream;

import lombok.Getter;

/**
 * Indicates that a change stream specification can't be used as given.
 */
@Getter
public class ChangeStreamConfigurationException extends IllegalArgumentException {
	private final ErrorCode code;

	public ChangeStreamConfigurationException(ErrorCode code, String message) {
		super(message + " [" + code.id() + "]");
		this.code = code;
	}

	public ChangeStreamConfigurationException(ErrorCode code, String message, Throwable cause) {
		super(message + " [" + code.id() + "]", cause);
		this.code = code;
	}
}
