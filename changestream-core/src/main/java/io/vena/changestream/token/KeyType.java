package io.vena.changestream.token;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.bson.BsonType;
import org.bson.BsonValue;

/**
 * The type classes of key string values, in sort order.
 * All numeric BSON types share {@link #NUMBER} so they compare by value.
 *
 * <p>
 * The marker bytes are part of the persisted token format and must never change.
 */
@Getter
@RequiredArgsConstructor
enum KeyType {
	MIN_KEY(0x0A),
	UNDEFINED(0x0F),
	NULL(0x14),
	NUMBER(0x1E),
	STRING(0x28),
	SYMBOL(0x29),
	DOCUMENT(0x32),
	ARRAY(0x3C),
	BINARY(0x46),
	OBJECT_ID(0x50),
	BOOLEAN(0x5A),
	DATE_TIME(0x64),
	TIMESTAMP(0x6E),
	REGULAR_EXPRESSION(0x78),
	DB_POINTER(0x7A),
	JAVASCRIPT(0x7D),
	JAVASCRIPT_WITH_SCOPE(0x7E),
	MAX_KEY(0x7F),
	;

	/**
	 * Never used as a marker; terminates documents and arrays so shorter ones sort first.
	 */
	static final byte END = 0x00;

	private final int marker;

	static KeyType of(BsonValue value) {
		return of(value.getBsonType());
	}

	static KeyType of(BsonType type) {
		return switch (type) {
			case MIN_KEY -> MIN_KEY;
			case UNDEFINED -> UNDEFINED;
			case NULL -> NULL;
			case INT32, INT64, DOUBLE, DECIMAL128 -> NUMBER;
			case STRING -> STRING;
			case SYMBOL -> SYMBOL;
			case DOCUMENT -> DOCUMENT;
			case ARRAY -> ARRAY;
			case BINARY -> BINARY;
			case OBJECT_ID -> OBJECT_ID;
			case BOOLEAN -> BOOLEAN;
			case DATE_TIME -> DATE_TIME;
			case TIMESTAMP -> TIMESTAMP;
			case REGULAR_EXPRESSION -> REGULAR_EXPRESSION;
			case DB_POINTER -> DB_POINTER;
			case JAVASCRIPT -> JAVASCRIPT;
			case JAVASCRIPT_WITH_SCOPE -> JAVASCRIPT_WITH_SCOPE;
			case MAX_KEY -> MAX_KEY;
			case END_OF_DOCUMENT -> throw new IllegalArgumentException("Not a value type: " + type);
		};
	}

	static KeyType fromMarker(int marker) {
		for (KeyType t: values()) {
			if (t.marker == marker) {
				return t;
			}
		}
		throw new IllegalArgumentException(String.format("Unrecognized key type marker 0x%02X", marker));
	}

	/**
	 * Distinguishes numeric types that compare equal by value.
	 * Each is followed by an exact representation of the number, whose length depends on the type.
	 */
	@Getter
	@RequiredArgsConstructor
	enum NumericType {
		INT32(1, 4),
		INT64(2, 8),
		DOUBLE(3, 0),
		DECIMAL128(4, 16),
		;

		private final int marker;
		private final int exactLength;

		static NumericType of(BsonType type) {
			return switch (type) {
				case INT32 -> INT32;
				case INT64 -> INT64;
				case DOUBLE -> DOUBLE;
				case DECIMAL128 -> DECIMAL128;
				default -> throw new IllegalArgumentException("Not a numeric type: " + type);
			};
		}

		static NumericType fromMarker(int marker) {
			for (NumericType t: values()) {
				if (t.marker == marker) {
					return t;
				}
			}
			throw new IllegalArgumentException(String.format("Unrecognized numeric type marker 0x%02X", marker));
		}
	}
}
