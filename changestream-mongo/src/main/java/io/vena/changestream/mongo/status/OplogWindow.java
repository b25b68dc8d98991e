package io.vena.changestream.mongo.status;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.vena.changestream.token.ResumeToken;
import org.bson.BsonTimestamp;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL;

/**
 * The oldest and newest entries currently in the oplog.
 * A stream can resume only from a position no older than {@link #first()}.
 */
public record OplogWindow(
	@JsonInclude(NON_NULL) String error,
	@JsonInclude(NON_NULL) OpTime first,
	@JsonInclude(NON_NULL) OpTime last
) {
	public record OpTime(long t, long i) {
		static OpTime of(BsonTimestamp ts) {
			return new OpTime(Integer.toUnsignedLong(ts.getTime()), Integer.toUnsignedLong(ts.getInc()));
		}

		BsonTimestamp toBsonTimestamp() {
			return new BsonTimestamp((int) t, (int) i);
		}
	}

	public static OplogWindow of(BsonTimestamp first, BsonTimestamp last) {
		return new OplogWindow(null, OpTime.of(first), OpTime.of(last));
	}

	public static OplogWindow unavailable(String error) {
		return new OplogWindow(error, null, null);
	}

	@JsonIgnore
	public boolean isAvailable() {
		return error == null;
	}

	/**
	 * @return true if the event that produced <code>token</code> is still in the oplog
	 */
	public boolean canResumeFrom(ResumeToken token) {
		return isAvailable()
			&& Long.compareUnsigned(token.clusterTime().getValue(), first.toBsonTimestamp().getValue()) >= 0;
	}
}
