package com.mongodb.chunkplanner.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonMaxKey;
import org.bson.BsonMinKey;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

public class ShardKeyComparatorTest {

	private final static ShardKeyComparator comparator = ShardKeyComparator.INSTANCE;

	@Test
	public void testNumbersCompareAcrossTypes() {
		assertEquals(0, comparator.compare(new BsonInt32(5), new BsonInt64(5)));
		assertEquals(0, comparator.compare(new BsonInt64(5), new BsonDouble(5.0)));
		assertTrue(comparator.compare(new BsonInt32(5), new BsonDouble(5.5)) < 0);
		assertTrue(comparator.compare(new BsonInt64(100), new BsonInt32(99)) > 0);
	}

	@Test
	public void testMinKeyAndMaxKeyBoundEverything() {
		assertTrue(comparator.compare(new BsonMinKey(), new BsonInt32(Integer.MIN_VALUE)) < 0);
		assertTrue(comparator.compare(new BsonMinKey(), new BsonString("")) < 0);
		assertTrue(comparator.compare(new BsonMaxKey(), new BsonString("zzz")) > 0);
		assertEquals(0, comparator.compare(new BsonMinKey(), new BsonMinKey()));
	}

	@Test
	public void testNumbersSortBeforeStrings() {
		assertTrue(comparator.compare(new BsonInt32(1000), new BsonString("1")) < 0);
	}

	@Test
	public void testCompareDocsFieldByField() {
		BsonDocument a = new BsonDocument("category_id", new BsonInt32(5)).append("product_id", new BsonMinKey());
		BsonDocument b = new BsonDocument("category_id", new BsonInt32(5)).append("product_id", new BsonInt32(1));
		BsonDocument c = new BsonDocument("category_id", new BsonInt32(6)).append("product_id", new BsonMinKey());

		assertTrue(comparator.compareDocs(a, b) < 0);
		assertTrue(comparator.compareDocs(b, c) < 0);
		assertTrue(comparator.compareDocs(c, a) > 0);
		assertEquals(0, comparator.compareDocs(a, a.clone()));
	}

	@Test
	public void testShorterDocumentSortsFirst() {
		BsonDocument prefix = new BsonDocument("category_id", new BsonInt32(5));
		BsonDocument full = new BsonDocument("category_id", new BsonInt32(5)).append("product_id", new BsonInt32(1));
		assertTrue(comparator.compareDocs(prefix, full) < 0);
	}
}
