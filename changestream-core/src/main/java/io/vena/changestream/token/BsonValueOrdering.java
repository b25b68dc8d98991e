package io.vena.changestream.token;

import io.vena.changestream.token.KeyType.NumericType;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonDbPointer;
import org.bson.BsonDocument;
import org.bson.BsonJavaScriptWithScope;
import org.bson.BsonRegularExpression;
import org.bson.BsonValue;
import org.bson.types.Decimal128;

/**
 * The total order on BSON values that {@link KeyStringEncoder} preserves.
 *
 * <ol><li>
 *     Values of different {@link KeyType}s compare by type.
 * </li><li>
 *     Numbers compare by their value as a <code>double</code>, then by {@link NumericType}.
 *     Integers of the same type then compare by value, but <code>Decimal128</code>s compare by their
 *     raw BID encoding, which is not numeric order between decimals that round to the same <code>double</code>.
 * </li><li>
 *     Strings, symbols, and JavaScript code compare by their UTF-8 bytes.
 * </li><li>
 *     Documents compare element by element: value type, then field name, then value.
 *     A document that is a prefix of another sorts first. Arrays work the same way without names.
 * </li><li>
 *     Binary values compare by length, then subtype, then bytes.
 * </li><li>
 *     DBPointers compare by namespace, then ObjectId.
 *     JavaScript with scope compares by code, then scope document.
 * </li></ol>
 *
 * Byte sequences are always compared unsigned.
 */
public final class BsonValueOrdering implements Comparator<BsonValue> {
	public static final BsonValueOrdering INSTANCE = new BsonValueOrdering();

	private BsonValueOrdering() { }

	@Override
	public int compare(BsonValue left, BsonValue right) {
		KeyType leftType = KeyType.of(left);
		KeyType rightType = KeyType.of(right);
		if (leftType != rightType) {
			return Integer.compare(leftType.marker(), rightType.marker());
		}
		return switch (leftType) {
			case MIN_KEY, UNDEFINED, NULL, MAX_KEY -> 0;
			case NUMBER -> compareNumbers(left, right);
			case STRING -> compareUtf8(left.asString().getValue(), right.asString().getValue());
			case SYMBOL -> compareUtf8(left.asSymbol().getSymbol(), right.asSymbol().getSymbol());
			case JAVASCRIPT -> compareUtf8(left.asJavaScript().getCode(), right.asJavaScript().getCode());
			case DOCUMENT -> compareDocuments(left.asDocument(), right.asDocument());
			case ARRAY -> compareArrays(left.asArray(), right.asArray());
			case BINARY -> compareBinaries(left.asBinary(), right.asBinary());
			case OBJECT_ID -> Arrays.compareUnsigned(left.asObjectId().getValue().toByteArray(), right.asObjectId().getValue().toByteArray());
			case BOOLEAN -> Boolean.compare(left.asBoolean().getValue(), right.asBoolean().getValue());
			case DATE_TIME -> Long.compare(left.asDateTime().getValue(), right.asDateTime().getValue());
			case TIMESTAMP -> Long.compareUnsigned(left.asTimestamp().getValue(), right.asTimestamp().getValue());
			case REGULAR_EXPRESSION -> compareRegularExpressions(left.asRegularExpression(), right.asRegularExpression());
			case DB_POINTER -> compareDbPointers(left.asDBPointer(), right.asDBPointer());
			case JAVASCRIPT_WITH_SCOPE -> compareJavaScriptWithScope(left.asJavaScriptWithScope(), right.asJavaScriptWithScope());
		};
	}

	private int compareDocuments(BsonDocument left, BsonDocument right) {
		Iterator<Map.Entry<String, BsonValue>> leftIter = left.entrySet().iterator();
		Iterator<Map.Entry<String, BsonValue>> rightIter = right.entrySet().iterator();
		while (leftIter.hasNext() && rightIter.hasNext()) {
			var leftEntry = leftIter.next();
			var rightEntry = rightIter.next();
			int result = Integer.compare(
				KeyType.of(leftEntry.getValue()).marker(),
				KeyType.of(rightEntry.getValue()).marker());
			if (result == 0) {
				result = compareUtf8(leftEntry.getKey(), rightEntry.getKey());
			}
			if (result == 0) {
				result = compare(leftEntry.getValue(), rightEntry.getValue());
			}
			if (result != 0) {
				return result;
			}
		}
		return Boolean.compare(leftIter.hasNext(), rightIter.hasNext());
	}

	private int compareArrays(BsonArray left, BsonArray right) {
		int common = Math.min(left.size(), right.size());
		for (int i = 0; i < common; i++) {
			int result = compare(left.get(i), right.get(i));
			if (result != 0) {
				return result;
			}
		}
		return Integer.compare(left.size(), right.size());
	}

	private static int compareBinaries(BsonBinary left, BsonBinary right) {
		int result = Integer.compare(left.getData().length, right.getData().length);
		if (result == 0) {
			result = Integer.compare(left.getType() & 0xFF, right.getType() & 0xFF);
		}
		if (result == 0) {
			result = Arrays.compareUnsigned(left.getData(), right.getData());
		}
		return result;
	}

	private static int compareRegularExpressions(BsonRegularExpression left, BsonRegularExpression right) {
		int result = compareUtf8(left.getPattern(), right.getPattern());
		if (result == 0) {
			result = compareUtf8(left.getOptions(), right.getOptions());
		}
		return result;
	}

	private static int compareDbPointers(BsonDbPointer left, BsonDbPointer right) {
		int result = compareUtf8(left.getNamespace(), right.getNamespace());
		if (result == 0) {
			result = Arrays.compareUnsigned(left.getId().toByteArray(), right.getId().toByteArray());
		}
		return result;
	}

	private int compareJavaScriptWithScope(BsonJavaScriptWithScope left, BsonJavaScriptWithScope right) {
		int result = compareUtf8(left.getCode(), right.getCode());
		if (result == 0) {
			result = compareDocuments(left.getScope(), right.getScope());
		}
		return result;
	}

	private static int compareNumbers(BsonValue left, BsonValue right) {
		int result = Double.compare(approximateDouble(left), approximateDouble(right));
		if (result != 0) {
			return result;
		}
		NumericType leftType = NumericType.of(left.getBsonType());
		NumericType rightType = NumericType.of(right.getBsonType());
		if (leftType != rightType) {
			return Integer.compare(leftType.marker(), rightType.marker());
		}
		return switch (leftType) {
			case INT32 -> Integer.compare(left.asInt32().getValue(), right.asInt32().getValue());
			case INT64 -> Long.compare(left.asInt64().getValue(), right.asInt64().getValue());
			case DOUBLE -> 0;
			case DECIMAL128 -> {
				Decimal128 l = left.asDecimal128().getValue();
				Decimal128 r = right.asDecimal128().getValue();
				int high = Long.compareUnsigned(l.getHigh(), r.getHigh());
				yield (high != 0) ? high : Long.compareUnsigned(l.getLow(), r.getLow());
			}
		};
	}

	static double approximateDouble(BsonValue number) {
		return switch (number.getBsonType()) {
			case INT32 -> number.asInt32().getValue();
			case INT64 -> (double) number.asInt64().getValue();
			case DOUBLE -> number.asDouble().getValue();
			case DECIMAL128 -> number.asDecimal128().getValue().doubleValue();
			default -> throw new IllegalArgumentException("Not a number: " + number);
		};
	}

	static int compareUtf8(String left, String right) {
		return Arrays.compareUnsigned(
			left.getBytes(StandardCharsets.UTF_8),
			right.getBytes(StandardCharsets.UTF_8));
	}
}
