package io.vena.changestream.stages;

import io.vena.changestream.Source;

/**
 * One step of a change stream pipeline, pulling from the step before it.
 */
public sealed interface Stage<T> extends Source<T> permits
	OplogMatchStage,
	TransformationStage,
	EnsureResumeTokenPresentStage,
	CloseCursorStage,
	PostImageLookupStage,
	EventMatchStage
{
	/**
	 * For diagnostics.
	 */
	default String stageName() {
		return getClass().getSimpleName();
	}
}
