package com.mongodb.chunkplanner.split;

import java.util.ArrayList;
import java.util.List;

import org.bson.BsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.chunkplanner.InvalidDomainException;
import com.mongodb.chunkplanner.model.KeyRange;
import com.mongodb.chunkplanner.model.ShardKeyPattern;
import com.mongodb.chunkplanner.util.ShardKeyComparator;

/**
 * Computes K half-open ranges over the composite shard key from the primary field's
 * domain. Boundary j (0 &lt; j &lt; K) is the domain value at position floor(j * size / K)
 * paired with a MinKey tiebreaker; the outer bounds are the MinKey and MaxKey sentinels,
 * so the ranges cover the whole key space.
 */
public class RangeSplitter {

	private static Logger logger = LoggerFactory.getLogger(RangeSplitter.class);

	private final ShardKeyPattern keyPattern;

	public RangeSplitter(ShardKeyPattern keyPattern) {
		this.keyPattern = keyPattern;
	}

	public List<KeyRange> split(KeyDomain domain, int splitCount) {
		if (splitCount < 1) {
			throw new InvalidDomainException("split count must be at least 1, was " + splitCount);
		}
		long size = domain.size();
		if (size < splitCount) {
			throw new InvalidDomainException(
					String.format("%s has %d distinct values, cannot produce %d ranges", domain, size, splitCount));
		}

		List<BsonDocument> boundaries = new ArrayList<>(splitCount + 1);
		boundaries.add(keyPattern.globalMin());
		long whole = size / splitCount;
		long remainder = size % splitCount;
		for (int j = 1; j < splitCount; j++) {
			// floor(j * size / k) without overflowing j * size
			long position = j * whole + (j * remainder) / splitCount;
			boundaries.add(keyPattern.boundaryAt(domain.valueAt(position)));
		}
		boundaries.add(keyPattern.globalMax());

		List<KeyRange> ranges = new ArrayList<>(splitCount);
		for (int i = 0; i < splitCount; i++) {
			ranges.add(new KeyRange(boundaries.get(i), boundaries.get(i + 1)));
		}
		checkPartition(ranges);
		logger.debug("split {} into {} ranges", domain, ranges.size());
		return ranges;
	}

	/**
	 * Ranges must be contiguous, strictly increasing and span MinKey to MaxKey.
	 */
	public void checkPartition(List<KeyRange> ranges) {
		if (ranges.isEmpty()) {
			throw new IllegalStateException("no ranges");
		}
		if (!ranges.get(0).getLowerBound().equals(keyPattern.globalMin())) {
			throw new IllegalStateException("first range does not start at the global minimum: " + ranges.get(0));
		}
		if (!ranges.get(ranges.size() - 1).getUpperBound().equals(keyPattern.globalMax())) {
			throw new IllegalStateException("last range does not end at the global maximum: " + ranges.get(ranges.size() - 1));
		}
		for (int i = 0; i + 1 < ranges.size(); i++) {
			KeyRange current = ranges.get(i);
			KeyRange next = ranges.get(i + 1);
			if (!current.getUpperBound().equals(next.getLowerBound())) {
				throw new IllegalStateException(String.format("gap or overlap between range %d %s and %d %s", i, current,
						i + 1, next));
			}
			if (ShardKeyComparator.INSTANCE.compareDocs(current.getLowerBound(), next.getLowerBound()) >= 0) {
				throw new IllegalStateException("ranges out of order at " + i);
			}
		}
	}
}
