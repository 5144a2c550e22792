package com.mongodb.chunkplanner.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.junit.jupiter.api.Test;

public class KeyRangeTest {

	private final static ShardKeyPattern pattern = new ShardKeyPattern("category_id", "product_id");

	private static KeyRange range(int lo, int hi) {
		return new KeyRange(pattern.boundaryAt(new BsonInt32(lo)), pattern.boundaryAt(new BsonInt32(hi)));
	}

	@Test
	public void testHalfOpen() {
		KeyRange r = range(3, 6);
		assertTrue(r.contains(pattern.boundaryAt(new BsonInt32(3))));
		assertTrue(r.contains(pattern.key(new BsonInt32(5), new BsonInt32(999))));
		assertFalse(r.contains(pattern.boundaryAt(new BsonInt32(6))));
		assertFalse(r.contains(pattern.key(new BsonInt32(2), new BsonInt32(999))));
	}

	@Test
	public void testOverlaps() {
		assertTrue(range(0, 5).overlaps(range(4, 8)));
		assertFalse(range(0, 5).overlaps(range(5, 8)));
		assertFalse(range(5, 8).overlaps(range(0, 5)));
	}

	@Test
	public void testEmptyRangeRejected() {
		assertThrows(IllegalArgumentException.class, () -> range(5, 5));
		assertThrows(IllegalArgumentException.class, () -> range(6, 5));
	}

	@Test
	public void testGlobalMin() {
		assertTrue(new KeyRange(pattern.globalMin(), pattern.boundaryAt(new BsonInt32(1))).isGlobalMin());
		assertFalse(range(0, 1).isGlobalMin());
	}

	@Test
	public void testBoundsAreCopied() {
		BsonDocument lower = pattern.boundaryAt(new BsonInt32(3));
		KeyRange r = new KeyRange(lower, pattern.boundaryAt(new BsonInt32(6)));
		lower.put("category_id", new BsonInt32(9));
		r.getUpperBound().put("category_id", new BsonInt32(1));
		assertEquals(pattern.boundaryAt(new BsonInt32(3)), r.getLowerBound());
		assertEquals(pattern.boundaryAt(new BsonInt32(6)), r.getUpperBound());
	}
}
