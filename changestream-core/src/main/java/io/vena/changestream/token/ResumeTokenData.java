package io.vena.changestream.token;

import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;

import static java.util.Objects.requireNonNull;

/**
 * A logical position in a change stream.
 *
 * <p>
 * Ordered by <code>clusterTime</code> (unsigned), then <code>uuid</code>
 * (absent first, then by unsigned bytes), then <code>documentKey</code>
 * according to {@link BsonValueOrdering}. This is the order in which events are emitted,
 * and it is also the order of the encoded {@link ResumeToken}s.
 *
 * @param documentKey empty for events that don't concern a single document
 */
public record ResumeTokenData(
	BsonTimestamp clusterTime,
	Optional<UUID> uuid,
	BsonDocument documentKey
) implements Comparable<ResumeTokenData> {
	public ResumeTokenData {
		requireNonNull(clusterTime);
		requireNonNull(uuid);
		documentKey = documentKey.clone();
	}

	public static ResumeTokenData of(BsonTimestamp clusterTime) {
		return new ResumeTokenData(clusterTime, Optional.empty(), new BsonDocument());
	}

	public static ResumeTokenData of(BsonTimestamp clusterTime, UUID uuid) {
		return new ResumeTokenData(clusterTime, Optional.of(uuid), new BsonDocument());
	}

	public static ResumeTokenData of(BsonTimestamp clusterTime, UUID uuid, BsonDocument documentKey) {
		return new ResumeTokenData(clusterTime, Optional.of(uuid), documentKey);
	}

	/**
	 * @return a copy; this object never changes
	 */
	@Override
	public BsonDocument documentKey() {
		return documentKey.clone();
	}

	@Override
	public int compareTo(ResumeTokenData other) {
		return ORDER.compare(this, other);
	}

	private static final Comparator<UUID> UUID_ORDER = Comparator
		.comparing(UUID::getMostSignificantBits, Long::compareUnsigned)
		.thenComparing(UUID::getLeastSignificantBits, Long::compareUnsigned);

	private static final Comparator<ResumeTokenData> ORDER = Comparator
		.comparing((ResumeTokenData d) -> d.clusterTime.getValue(), Long::compareUnsigned)
		.thenComparing(d -> d.uuid, (l, r) -> {
			if (l.isPresent() && r.isPresent()) {
				return UUID_ORDER.compare(l.get(), r.get());
			} else {
				return Boolean.compare(l.isPresent(), r.isPresent());
			}
		})
		.thenComparing(d -> d.documentKey, BsonValueOrdering.INSTANCE);
}
