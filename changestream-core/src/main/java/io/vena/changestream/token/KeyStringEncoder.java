package io.vena.changestream.token;

import io.vena.changestream.token.KeyType.NumericType;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.io.BasicOutputBuffer;
import org.bson.types.Decimal128;

import static io.vena.changestream.token.BsonValueOrdering.approximateDouble;

/**
 * Writes BSON values as byte strings whose unsigned lexicographic order
 * matches {@link BsonValueOrdering}.
 *
 * <p>
 * Every value's encoding is self-delimiting, so encodings can be concatenated
 * and still compare correctly. {@link KeyStringDecoder} reverses this exactly.
 * All multi-byte integers are big-endian.
 */
final class KeyStringEncoder {
	private final BasicOutputBuffer out;

	KeyStringEncoder(BasicOutputBuffer out) {
		this.out = out;
	}

	void writeTimestamp(long value) {
		writeLong(value);
	}

	void writeUuid(UUID uuid) {
		writeLong(uuid.getMostSignificantBits());
		writeLong(uuid.getLeastSignificantBits());
	}

	void writeByte(int value) {
		out.writeByte(value);
	}

	/**
	 * Writes the contents of <code>document</code> as a top-level key, without a type marker.
	 */
	void writeDocumentBody(BsonDocument document) {
		for (Map.Entry<String, BsonValue> entry: document.entrySet()) {
			out.writeByte(KeyType.of(entry.getValue()).marker());
			writeString(entry.getKey());
			writeValueBody(entry.getValue());
		}
		out.writeByte(KeyType.END);
	}

	private void writeArrayBody(BsonArray array) {
		for (BsonValue element: array) {
			writeValue(element);
		}
		out.writeByte(KeyType.END);
	}

	void writeValue(BsonValue value) {
		out.writeByte(KeyType.of(value).marker());
		writeValueBody(value);
	}

	private void writeValueBody(BsonValue value) {
		switch (KeyType.of(value)) {
			case MIN_KEY, UNDEFINED, NULL, MAX_KEY -> { }
			case NUMBER -> writeNumber(value);
			case STRING -> writeString(value.asString().getValue());
			case SYMBOL -> writeString(value.asSymbol().getSymbol());
			case JAVASCRIPT -> writeString(value.asJavaScript().getCode());
			case DOCUMENT -> writeDocumentBody(value.asDocument());
			case ARRAY -> writeArrayBody(value.asArray());
			case BINARY -> writeBinary(value.asBinary());
			case OBJECT_ID -> out.writeBytes(value.asObjectId().getValue().toByteArray());
			case BOOLEAN -> out.writeByte(value.asBoolean().getValue() ? 1 : 0);
			case DATE_TIME -> writeLong(value.asDateTime().getValue() ^ Long.MIN_VALUE);
			case TIMESTAMP -> writeLong(value.asTimestamp().getValue());
			case REGULAR_EXPRESSION -> {
				writeString(value.asRegularExpression().getPattern());
				writeString(value.asRegularExpression().getOptions());
			}
			case DB_POINTER -> {
				writeString(value.asDBPointer().getNamespace());
				out.writeBytes(value.asDBPointer().getId().toByteArray());
			}
			case JAVASCRIPT_WITH_SCOPE -> {
				writeString(value.asJavaScriptWithScope().getCode());
				writeDocumentBody(value.asJavaScriptWithScope().getScope());
			}
		}
	}

	private void writeNumber(BsonValue value) {
		writeLong(sortableDoubleBits(approximateDouble(value)));
		NumericType type = NumericType.of(value.getBsonType());
		out.writeByte(type.marker());
		switch (type) {
			case INT32 -> writeInt(value.asInt32().getValue() ^ Integer.MIN_VALUE);
			case INT64 -> writeLong(value.asInt64().getValue() ^ Long.MIN_VALUE);
			case DOUBLE -> { }
			case DECIMAL128 -> {
				Decimal128 decimal = value.asDecimal128().getValue();
				writeLong(decimal.getHigh());
				writeLong(decimal.getLow());
			}
		}
	}

	private void writeBinary(BsonBinary binary) {
		writeInt(binary.getData().length);
		out.writeByte(binary.getType());
		out.writeBytes(binary.getData());
	}

	/**
	 * A zero byte becomes <code>00 FF</code>, and the string ends with <code>00 00</code>,
	 * so a string sorts before any longer string it is a prefix of.
	 */
	private void writeString(String value) {
		for (byte b: value.getBytes(StandardCharsets.UTF_8)) {
			out.writeByte(b);
			if (b == 0) {
				out.writeByte(0xFF);
			}
		}
		out.writeByte(0);
		out.writeByte(0);
	}

	private void writeInt(int value) {
		out.writeByte(value >>> 24);
		out.writeByte(value >>> 16);
		out.writeByte(value >>> 8);
		out.writeByte(value);
	}

	private void writeLong(long value) {
		writeInt((int) (value >>> 32));
		writeInt((int) value);
	}

	/**
	 * Flips the sign bit of non-negative doubles and every bit of negative ones,
	 * so that unsigned comparison of the result agrees with {@link Double#compare}.
	 */
	static long sortableDoubleBits(double value) {
		long bits = Double.doubleToLongBits(value);
		return bits ^ ((bits >> 63) | Long.MIN_VALUE);
	}

	static double fromSortableDoubleBits(long sortable) {
		long bits = sortable ^ ((~sortable >> 63) | Long.MIN_VALUE);
		return Double.longBitsToDouble(bits);
	}
}
