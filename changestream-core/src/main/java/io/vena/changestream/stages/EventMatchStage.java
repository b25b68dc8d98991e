package io.vena.changestream.stages;

import io.vena.changestream.ChangeEvent;
import io.vena.changestream.GetNextResult;
import io.vena.changestream.Source;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;

/**
 * Client-side filtering of change events.
 * Pauses and closures from upstream always pass through.
 */
@RequiredArgsConstructor
public final class EventMatchStage implements Stage<ChangeEvent> {
	private final Source<ChangeEvent> upstream;
	private final Predicate<ChangeEvent> predicate;

	@Override
	public GetNextResult<ChangeEvent> getNext() {
		while (true) {
			GetNextResult<ChangeEvent> result = upstream.getNext();
			if (!result.isAdvanced() || predicate.test(result.value())) {
				return result;
			}
		}
	}
}
