package io.vena.changestream.token;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;
import org.bson.io.BasicOutputBuffer;

/**
 * The opaque, totally ordered form of a {@link ResumeTokenData}.
 *
 * <p>
 * Layout: cluster time (8 bytes), a uuid presence byte (followed by 16 bytes when present),
 * then the document key as a key string. Tokens compare as unsigned byte strings,
 * and that comparison agrees with {@link ResumeTokenData#compareTo}, so a stream can seek to
 * "the first event after this token" with a range scan.
 *
 * <p>
 * Clients see tokens as <code>{_data: "&lt;hex&gt;"}</code>. The hex digits are uppercase,
 * so string comparison of the <code>_data</code> field also agrees with token order.
 */
public final class ResumeToken implements Comparable<ResumeToken> {
	public static final String DATA_FIELD = "_data";

	private static final int NO_UUID = 0;
	private static final int HAS_UUID = 1;
	private static final HexFormat HEX = HexFormat.of().withUpperCase();

	private final byte[] bytes;

	private ResumeToken(byte[] bytes) {
		this.bytes = bytes;
	}

	public static ResumeToken fromData(ResumeTokenData data) {
		BasicOutputBuffer buffer = new BasicOutputBuffer();
		KeyStringEncoder encoder = new KeyStringEncoder(buffer);
		encoder.writeTimestamp(data.clusterTime().getValue());
		if (data.uuid().isPresent()) {
			encoder.writeByte(HAS_UUID);
			encoder.writeUuid(data.uuid().get());
		} else {
			encoder.writeByte(NO_UUID);
		}
		encoder.writeDocumentBody(data.documentKey());
		return new ResumeToken(buffer.toByteArray());
	}

	/**
	 * @throws MalformedResumeTokenException if the bytes were not produced by {@link #fromData}
	 */
	public static ResumeToken fromBytes(byte[] bytes) {
		ResumeToken result = new ResumeToken(bytes.clone());
		result.toData(); // Validate
		return result;
	}

	/**
	 * @param tokenDocument a value previously returned by {@link #toBsonDocument()}
	 * @throws MalformedResumeTokenException if <code>tokenDocument</code> is not a valid token
	 */
	public static ResumeToken parse(BsonValue tokenDocument) {
		if (!tokenDocument.isDocument()) {
			throw new MalformedResumeTokenException("Resume token must be a document; got " + tokenDocument.getBsonType());
		}
		BsonDocument doc = tokenDocument.asDocument();
		if (doc.size() != 1 || !doc.containsKey(DATA_FIELD)) {
			throw new MalformedResumeTokenException("Resume token must have exactly one field named " + DATA_FIELD + "; got " + doc.keySet());
		}
		BsonValue data = doc.get(DATA_FIELD);
		if (!data.isString()) {
			throw new MalformedResumeTokenException("Resume token " + DATA_FIELD + " must be a string; got " + data.getBsonType());
		}
		byte[] bytes;
		try {
			bytes = HEX.parseHex(data.asString().getValue());
		} catch (IllegalArgumentException e) {
			throw new MalformedResumeTokenException("Resume token " + DATA_FIELD + " is not a hex string", e);
		}
		return fromBytes(bytes);
	}

	public ResumeTokenData toData() {
		KeyStringDecoder decoder = new KeyStringDecoder(bytes);
		BsonTimestamp clusterTime = new BsonTimestamp(decoder.readTimestamp());
		Optional<UUID> uuid = switch (decoder.readByte()) {
			case NO_UUID -> Optional.empty();
			case HAS_UUID -> Optional.of(decoder.readUuid());
			default -> throw new MalformedResumeTokenException("Invalid uuid marker in resume token");
		};
		BsonDocument documentKey = decoder.readDocumentBody();
		if (decoder.hasRemaining()) {
			throw new MalformedResumeTokenException("Unexpected trailing bytes in resume token");
		}
		return new ResumeTokenData(clusterTime, uuid, documentKey);
	}

	public BsonTimestamp clusterTime() {
		return new BsonTimestamp(new KeyStringDecoder(bytes).readTimestamp());
	}

	public byte[] toBytes() {
		return bytes.clone();
	}

	public BsonDocument toBsonDocument() {
		return new BsonDocument(DATA_FIELD, new BsonString(HEX.formatHex(bytes)));
	}

	@Override
	public int compareTo(ResumeToken other) {
		return Arrays.compareUnsigned(bytes, other.bytes);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ResumeToken)) return false;
		return Arrays.equals(bytes, ((ResumeToken) o).bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return HEX.formatHex(bytes);
	}
}
