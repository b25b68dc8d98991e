package io.vena.changestream.token;

import io.vena.changestream.token.KeyType.NumericType;
import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDbPointer;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonJavaScript;
import org.bson.BsonJavaScriptWithScope;
import org.bson.BsonMaxKey;
import org.bson.BsonMinKey;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonRegularExpression;
import org.bson.BsonString;
import org.bson.BsonSymbol;
import org.bson.BsonTimestamp;
import org.bson.BsonUndefined;
import org.bson.BsonValue;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import static io.vena.changestream.token.KeyStringEncoder.fromSortableDoubleBits;

/**
 * Reads what {@link KeyStringEncoder} wrote.
 * Any inconsistency in the input is reported as a {@link MalformedResumeTokenException}.
 */
final class KeyStringDecoder {
	/**
	 * The deepest nesting MongoDB itself accepts, so any token we encoded decodes.
	 */
	static final int MAX_DEPTH = 200;

	private final ByteBuffer in;
	private int depth = 0;

	KeyStringDecoder(byte[] bytes) {
		this.in = ByteBuffer.wrap(bytes);
	}

	long readTimestamp() {
		return readLong();
	}

	UUID readUuid() {
		long most = readLong();
		long least = readLong();
		return new UUID(most, least);
	}

	int readByte() {
		try {
			return in.get() & 0xFF;
		} catch (BufferUnderflowException e) {
			throw new MalformedResumeTokenException("Resume token ended unexpectedly at offset " + in.position(), e);
		}
	}

	boolean hasRemaining() {
		return in.hasRemaining();
	}

	BsonDocument readDocumentBody() {
		enterNested();
		BsonDocument result = new BsonDocument();
		for (int marker = readByte(); marker != KeyType.END; marker = readByte()) {
			KeyType type = keyType(marker);
			String name = readString();
			if (result.containsKey(name)) {
				throw new MalformedResumeTokenException("Duplicate field \"" + name + "\" in resume token document");
			}
			result.append(name, readValueBody(type));
		}
		depth--;
		return result;
	}

	private BsonArray readArrayBody() {
		enterNested();
		BsonArray result = new BsonArray();
		for (int marker = readByte(); marker != KeyType.END; marker = readByte()) {
			result.add(readValueBody(keyType(marker)));
		}
		depth--;
		return result;
	}

	/**
	 * Any exception abandons the whole decode, so <code>depth</code> needs no unwinding on the way out.
	 */
	private void enterNested() {
		if (++depth > MAX_DEPTH) {
			throw new MalformedResumeTokenException("Resume token nests documents and arrays deeper than " + MAX_DEPTH + " levels");
		}
	}

	private BsonValue readValueBody(KeyType type) {
		return switch (type) {
			case MIN_KEY -> new BsonMinKey();
			case UNDEFINED -> new BsonUndefined();
			case NULL -> BsonNull.VALUE;
			case MAX_KEY -> new BsonMaxKey();
			case NUMBER -> readNumber();
			case STRING -> new BsonString(readString());
			case SYMBOL -> new BsonSymbol(readString());
			case JAVASCRIPT -> new BsonJavaScript(readString());
			case DOCUMENT -> readDocumentBody();
			case ARRAY -> readArrayBody();
			case BINARY -> readBinary();
			case OBJECT_ID -> new BsonObjectId(new ObjectId(readBytes(12)));
			case BOOLEAN -> BsonBoolean.valueOf(readBoolean());
			case DATE_TIME -> new BsonDateTime(readLong() ^ Long.MIN_VALUE);
			case TIMESTAMP -> new BsonTimestamp(readLong());
			case REGULAR_EXPRESSION -> {
				String pattern = readString();
				String options = readString();
				yield new BsonRegularExpression(pattern, options);
			}
			case DB_POINTER -> {
				String namespace = readString();
				yield new BsonDbPointer(namespace, new ObjectId(readBytes(12)));
			}
			case JAVASCRIPT_WITH_SCOPE -> {
				String code = readString();
				yield new BsonJavaScriptWithScope(code, readDocumentBody());
			}
		};
	}

	private BsonValue readNumber() {
		double approximation = fromSortableDoubleBits(readLong());
		NumericType type = numericType(readByte());
		return switch (type) {
			case INT32 -> new BsonInt32(readInt() ^ Integer.MIN_VALUE);
			case INT64 -> new BsonInt64(readLong() ^ Long.MIN_VALUE);
			case DOUBLE -> new BsonDouble(approximation);
			case DECIMAL128 -> {
				long high = readLong();
				long low = readLong();
				yield new BsonDecimal128(Decimal128.fromIEEE754BIDEncoding(high, low));
			}
		};
	}

	private BsonBinary readBinary() {
		int length = readInt();
		if (length < 0 || length > in.remaining()) {
			throw new MalformedResumeTokenException("Invalid binary length " + length + " in resume token");
		}
		byte subtype = (byte) readByte();
		return new BsonBinary(subtype, readBytes(length));
	}

	private boolean readBoolean() {
		int value = readByte();
		if (value > 1) {
			throw new MalformedResumeTokenException("Invalid boolean value " + value + " in resume token");
		}
		return value == 1;
	}

	private String readString() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		while (true) {
			int b = readByte();
			if (b != 0) {
				bytes.write(b);
				continue;
			}
			int next = readByte();
			if (next == 0) {
				return bytes.toString(StandardCharsets.UTF_8);
			} else if (next == 0xFF) {
				bytes.write(0);
			} else {
				throw new MalformedResumeTokenException(String.format("Invalid string escape 0x%02X in resume token", next));
			}
		}
	}

	private byte[] readBytes(int length) {
		try {
			byte[] result = new byte[length];
			in.get(result);
			return result;
		} catch (BufferUnderflowException e) {
			throw new MalformedResumeTokenException("Resume token ended unexpectedly at offset " + in.position(), e);
		}
	}

	private int readInt() {
		try {
			return in.getInt();
		} catch (BufferUnderflowException e) {
			throw new MalformedResumeTokenException("Resume token ended unexpectedly at offset " + in.position(), e);
		}
	}

	private long readLong() {
		try {
			return in.getLong();
		} catch (BufferUnderflowException e) {
			throw new MalformedResumeTokenException("Resume token ended unexpectedly at offset " + in.position(), e);
		}
	}

	private static KeyType keyType(int marker) {
		try {
			return KeyType.fromMarker(marker);
		} catch (IllegalArgumentException e) {
			throw new MalformedResumeTokenException(e.getMessage(), e);
		}
	}

	private static NumericType numericType(int marker) {
		try {
			return NumericType.fromMarker(marker);
		} catch (IllegalArgumentException e) {
			throw new MalformedResumeTokenException(e.getMessage(), e);
		}
	}
}
