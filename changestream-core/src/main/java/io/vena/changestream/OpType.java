package io.vena.changestream;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The kinds of records in the oplog, with their single-letter wire codes.
 */
@Getter
@RequiredArgsConstructor
public enum OpType {
	INSERT("i"),
	UPDATE("u"),
	DELETE("d"),
	COMMAND("c"),
	NOOP("n"),
	;

	private final String code;

	public static OpType fromCode(String code) {
		return Arrays.stream(values())
			.filter(t -> t.code.equals(code))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Unrecognized oplog op type: \"" + code + "\""));
	}

	public boolean isCrud() {
		return this == INSERT || this == UPDATE || this == DELETE;
	}
}
