package io.vena.changestream;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reasons a change stream can't be opened.
 * The numeric ids are stable and match those clients already know from MongoDB servers.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
	FAILED_TO_PARSE(9),
	TYPE_MISMATCH(14),
	UNKNOWN_OPTION(40415),
	REPLICATION_REQUIRED(40573),
	UNRECOGNIZED_FULL_DOCUMENT_OPTION(40575),
	POST_IMAGE_LOOKUP_UNAVAILABLE(40576),
	CONFLICTING_RESUME_OPTIONS(40674),
	;

	private final int id;
}
