package io.vena.changestream;

import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import static java.util.Arrays.stream;

@Getter
@RequiredArgsConstructor
public enum FullDocumentMode {
	/**
	 * Only inserts and replaces carry a full document.
	 */
	DEFAULT("default"),

	/**
	 * Update events also carry the current version of the document, looked up when the event is emitted.
	 */
	UPDATE_LOOKUP("updateLookup"),
	;

	private final String optionValue;

	public static Optional<FullDocumentMode> fromOptionValue(String value) {
		return stream(values())
			.filter(m -> m.optionValue.equals(value))
			.findFirst();
	}
}
