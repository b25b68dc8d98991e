package io.vena.changestream;

import org.slf4j.MDC;

import static io.vena.changestream.MdcKeys.EVENT;
import static io.vena.changestream.MdcKeys.STREAM_NAME;

final class MappedDiagnosticContext {

	static MDCScope setupMDC(String streamName) {
		MDCScope result = new MDCScope();
		MDC.put(STREAM_NAME, streamName);
		MDC.remove(EVENT);
		return result;
	}

	/**
	 * Like {@link org.slf4j.MDC.MDCCloseable} except that instead of
	 * deleting the MDC entries at the end, it restores their prior values,
	 * so scopes can nest.
	 *
	 * <p>
	 * Use this in a try block with no catch or finally clause:
	 * those would run after {@link #close()} and miss the diagnostic context.
	 */
	static final class MDCScope implements AutoCloseable {
		final String oldName = MDC.get(STREAM_NAME);
		final String oldEvent = MDC.get(EVENT);

		@Override public void close() {
			restore(STREAM_NAME, oldName);
			restore(EVENT, oldEvent);
		}

		private static void restore(String key, String oldValue) {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}

}
