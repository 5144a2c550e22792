package com.mongodb.chunkplanner.split;

import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonValue;

import com.mongodb.chunkplanner.InvalidDomainException;

/**
 * Integers in <code>[min, maxExclusive)</code>. Values that fit in an int are emitted as
 * BSON int32 so boundaries match documents written with 32 bit ids.
 */
public class IntegerKeyDomain implements KeyDomain {

	private final long min;
	private final long maxExclusive;

	public IntegerKeyDomain(long min, long maxExclusive) {
		if (maxExclusive <= min) {
			throw new InvalidDomainException(String.format("integer domain [%d, %d) is empty", min, maxExclusive));
		}
		if (maxExclusive - min <= 0) {
			throw new InvalidDomainException(String.format("integer domain [%d, %d) is too large", min, maxExclusive));
		}
		this.min = min;
		this.maxExclusive = maxExclusive;
	}

	@Override
	public long size() {
		return maxExclusive - min;
	}

	@Override
	public BsonValue valueAt(long index) {
		if (index < 0 || index >= size()) {
			throw new IndexOutOfBoundsException("index " + index + " outside domain of size " + size());
		}
		long value = min + index;
		if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
			return new BsonInt32((int) value);
		}
		return new BsonInt64(value);
	}

	public long getMin() {
		return min;
	}

	public long getMaxExclusive() {
		return maxExclusive;
	}

	@Override
	public String toString() {
		return String.format("IntegerKeyDomain[%d, %d)", min, maxExclusive);
	}
}
