package io.vena.changestream.stages;

import io.vena.changestream.ChangeEvent;
import io.vena.changestream.GetNextResult;
import io.vena.changestream.OplogEntry;
import io.vena.changestream.Source;
import java.util.Optional;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public final class TransformationStage implements Stage<ChangeEvent> {
	private final Source<OplogEntry> upstream;
	private final ChangeEventTransformer transformer;

	@Override
	public GetNextResult<ChangeEvent> getNext() {
		while (true) {
			GetNextResult<OplogEntry> result = upstream.getNext();
			if (!result.isAdvanced()) {
				return result.propagate();
			}
			Optional<ChangeEvent> event = transformer.transform(result.value());
			if (event.isPresent()) {
				return GetNextResult.advanced(event.get());
			}
		}
	}
}
