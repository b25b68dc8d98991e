package io.vena.changestream.stages;

import io.vena.changestream.GetNextResult;
import io.vena.changestream.OplogEntry;
import io.vena.changestream.Source;
import lombok.RequiredArgsConstructor;

/**
 * Passes along only the oplog entries accepted by an {@link OplogMatcher}.
 */
@RequiredArgsConstructor
public final class OplogMatchStage implements Stage<OplogEntry> {
	private final Source<OplogEntry> upstream;
	private final OplogMatcher matcher;

	@Override
	public GetNextResult<OplogEntry> getNext() {
		while (true) {
			GetNextResult<OplogEntry> result = upstream.getNext();
			if (!result.isAdvanced() || matcher.test(result.value())) {
				return result;
			}
		}
	}
}
