package com.mongodb.chunkplanner.model;

import org.apache.commons.lang3.StringUtils;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonMaxKey;
import org.bson.BsonMinKey;
import org.bson.BsonValue;

/**
 * Composite shard key made of a primary field (e.g. category) and a tiebreaker field
 * (e.g. document identifier), both ascending.
 */
public class ShardKeyPattern {

	private final String primaryField;
	private final String tiebreakerField;

	public ShardKeyPattern(String primaryField, String tiebreakerField) {
		if (StringUtils.isBlank(primaryField) || StringUtils.isBlank(tiebreakerField)) {
			throw new IllegalArgumentException("shard key fields must not be blank");
		}
		if (primaryField.equals(tiebreakerField)) {
			throw new IllegalArgumentException("primary and tiebreaker shard key fields must differ: " + primaryField);
		}
		this.primaryField = primaryField;
		this.tiebreakerField = tiebreakerField;
	}

	public String getPrimaryField() {
		return primaryField;
	}

	public String getTiebreakerField() {
		return tiebreakerField;
	}

	/**
	 * The key specification used with shardCollection, <code>{primary: 1, tiebreaker: 1}</code>.
	 */
	public BsonDocument toKeySpec() {
		return new BsonDocument(primaryField, new BsonInt32(1)).append(tiebreakerField, new BsonInt32(1));
	}

	/**
	 * Lowest key having the given primary value: the tiebreaker is MinKey, so every
	 * document with that primary value sorts at or after it.
	 */
	public BsonDocument boundaryAt(BsonValue primaryValue) {
		return key(primaryValue, new BsonMinKey());
	}

	public BsonDocument key(BsonValue primaryValue, BsonValue tiebreakerValue) {
		return new BsonDocument(primaryField, primaryValue).append(tiebreakerField, tiebreakerValue);
	}

	public BsonDocument globalMin() {
		return key(new BsonMinKey(), new BsonMinKey());
	}

	public BsonDocument globalMax() {
		return key(new BsonMaxKey(), new BsonMaxKey());
	}

	@Override
	public String toString() {
		return toKeySpec().toJson();
	}
}
