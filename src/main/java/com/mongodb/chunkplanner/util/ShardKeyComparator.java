package com.mongodb.chunkplanner.util;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;

import org.bson.BsonDocument;
import org.bson.BsonType;
import org.bson.BsonValue;

/**
 * Orders shard key values and bound documents the way the MongoDB server does.
 * 
 * @see <a href="https://www.mongodb.com/docs/manual/reference/bson-type-comparison-order/">BSON Types Comparison Order</a>
 */
public class ShardKeyComparator implements Comparator<BsonValue> {

	public static final ShardKeyComparator INSTANCE = new ShardKeyComparator();

	@SuppressWarnings({ "unchecked", "rawtypes" })
	@Override
	public int compare(BsonValue x, BsonValue y) {
		int xRank = typeRank(x.getBsonType());
		int yRank = typeRank(y.getBsonType());
		if (xRank != yRank) {
			return Integer.compare(xRank, yRank);
		}

		switch (x.getBsonType()) {
		case MIN_KEY:
		case MAX_KEY:
		case NULL:
		case UNDEFINED:
			return 0;
		case INT32:
		case INT64:
		case DOUBLE:
		case DECIMAL128:
			return toBigDecimal(x).compareTo(toBigDecimal(y));
		case STRING:
		case SYMBOL:
			return stringValue(x).compareTo(stringValue(y));
		case DOCUMENT:
			return compareDocs(x.asDocument(), y.asDocument());
		default:
			if (x instanceof Comparable && x.getBsonType() == y.getBsonType()) {
				return ((Comparable) x).compareTo(y);
			}
			throw new IllegalArgumentException("comparison not implemented for type " + x.getBsonType());
		}
	}

	public int compareDocs(BsonDocument x, BsonDocument y) {
		Iterator<Map.Entry<String, BsonValue>> xi = x.entrySet().iterator();
		Iterator<Map.Entry<String, BsonValue>> yi = y.entrySet().iterator();
		while (xi.hasNext() && yi.hasNext()) {
			Map.Entry<String, BsonValue> xe = xi.next();
			Map.Entry<String, BsonValue> ye = yi.next();
			int typeCompare = Integer.compare(typeRank(xe.getValue().getBsonType()), typeRank(ye.getValue().getBsonType()));
			if (typeCompare != 0) {
				return typeCompare;
			}
			int nameCompare = xe.getKey().compareTo(ye.getKey());
			if (nameCompare != 0) {
				return nameCompare;
			}
			int valueCompare = compare(xe.getValue(), ye.getValue());
			if (valueCompare != 0) {
				return valueCompare;
			}
		}
		return Boolean.compare(xi.hasNext(), yi.hasNext());
	}

	private static int typeRank(BsonType type) {
		switch (type) {
		case MIN_KEY:
			return 0;
		case UNDEFINED:
		case NULL:
			return 1;
		case INT32:
		case INT64:
		case DOUBLE:
		case DECIMAL128:
			return 2;
		case STRING:
		case SYMBOL:
			return 3;
		case DOCUMENT:
			return 4;
		case ARRAY:
			return 5;
		case BINARY:
			return 6;
		case OBJECT_ID:
			return 7;
		case BOOLEAN:
			return 8;
		case DATE_TIME:
			return 9;
		case TIMESTAMP:
			return 10;
		case REGULAR_EXPRESSION:
			return 11;
		case MAX_KEY:
			return 100;
		default:
			return 50;
		}
	}

	private static BigDecimal toBigDecimal(BsonValue v) {
		switch (v.getBsonType()) {
		case INT32:
			return BigDecimal.valueOf(v.asInt32().getValue());
		case INT64:
			return BigDecimal.valueOf(v.asInt64().getValue());
		case DOUBLE:
			return BigDecimal.valueOf(v.asDouble().getValue());
		default:
			return v.asDecimal128().getValue().bigDecimalValue();
		}
	}

	private static String stringValue(BsonValue v) {
		return v.isString() ? v.asString().getValue() : v.asSymbol().getSymbol();
	}
}
