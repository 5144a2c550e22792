package com.mongodb.chunkplanner.model;

import java.util.Objects;

import org.bson.BsonDocument;
import org.bson.BsonType;
import org.bson.BsonValue;

import com.mongodb.chunkplanner.util.ShardKeyComparator;

/**
 * Half-open range <code>[lowerBound, upperBound)</code> over the composite shard key.
 */
public class KeyRange {

	private final BsonDocument lowerBound;
	private final BsonDocument upperBound;

	public KeyRange(BsonDocument lowerBound, BsonDocument upperBound) {
		Objects.requireNonNull(lowerBound, "lowerBound");
		Objects.requireNonNull(upperBound, "upperBound");
		if (ShardKeyComparator.INSTANCE.compareDocs(lowerBound, upperBound) >= 0) {
			throw new IllegalArgumentException(
					String.format("empty key range, lower %s is not below upper %s", lowerBound.toJson(), upperBound.toJson()));
		}
		this.lowerBound = lowerBound.clone();
		this.upperBound = upperBound.clone();
	}

	public BsonDocument getLowerBound() {
		return lowerBound.clone();
	}

	public BsonDocument getUpperBound() {
		return upperBound.clone();
	}

	public boolean contains(BsonDocument key) {
		ShardKeyComparator c = ShardKeyComparator.INSTANCE;
		return c.compareDocs(lowerBound, key) <= 0 && c.compareDocs(key, upperBound) < 0;
	}

	public boolean overlaps(KeyRange other) {
		ShardKeyComparator c = ShardKeyComparator.INSTANCE;
		return c.compareDocs(lowerBound, other.upperBound) < 0 && c.compareDocs(other.lowerBound, upperBound) < 0;
	}

	/**
	 * True when the lower bound is MinKey in every field, i.e. the start of the key
	 * space, which is always a chunk boundary.
	 */
	public boolean isGlobalMin() {
		for (BsonValue v : lowerBound.values()) {
			if (v.getBsonType() != BsonType.MIN_KEY) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		return Objects.hash(lowerBound, upperBound);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof KeyRange))
			return false;
		KeyRange other = (KeyRange) obj;
		return lowerBound.equals(other.lowerBound) && upperBound.equals(other.upperBound);
	}

	@Override
	public String toString() {
		return "[" + lowerBound.toJson() + ", " + upperBound.toJson() + ")";
	}
}
