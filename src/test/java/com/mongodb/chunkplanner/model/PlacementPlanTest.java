package com.mongodb.chunkplanner.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.bson.BsonInt32;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.mongodb.chunkplanner.assign.RoundRobinChunkAssigner;
import com.mongodb.chunkplanner.split.IntegerKeyDomain;
import com.mongodb.chunkplanner.split.RangeSplitter;

public class PlacementPlanTest {

	private final static Namespace ns = new Namespace("marketplace.products");
	private final static ShardKeyPattern pattern = new ShardKeyPattern("category_id", "product_id");

	private PlacementPlan plan;

	@BeforeEach
	public void setUp() {
		List<KeyRange> ranges = new RangeSplitter(pattern).split(new IntegerKeyDomain(0, 10), 10);
		plan = new RoundRobinChunkAssigner().assign(ns, pattern, ranges, ShardTopology.ofIds("a", "b", "c"));
	}

	@Test
	public void testCountsByShardIncludesEmptyShards() {
		PlacementPlan small = plan.from(8);
		Map<String, Integer> counts = small.countsByShard();
		assertEquals(Arrays.asList("a", "b", "c"), new ArrayList<>(counts.keySet()));
		assertEquals(1, counts.get("a").intValue());
		assertEquals(0, counts.get("b").intValue());
		assertEquals(1, counts.get("c").intValue());
	}

	@Test
	public void testFromKeepsIndices() {
		PlacementPlan rest = plan.from(4);
		assertEquals(6, rest.size());
		assertEquals(4, rest.getEntries().get(0).getIndex());
		assertEquals(plan.getEntry(7), rest.getEntry(7));
		assertEquals(0, plan.from(10).size());
		assertThrows(IndexOutOfBoundsException.class, () -> plan.from(11));
	}

	@Test
	public void testShardFor() {
		assertEquals("a", plan.shardFor(pattern.key(new BsonInt32(0), new BsonInt32(42))));
		assertEquals("b", plan.shardFor(pattern.boundaryAt(new BsonInt32(1))));
		assertEquals("a", plan.shardFor(pattern.boundaryAt(new BsonInt32(9))));
		// below the domain still falls in the first range, which starts at MinKey
		assertEquals("a", plan.shardFor(pattern.boundaryAt(new BsonInt32(-5))));
		assertEquals("a", plan.shardFor(pattern.boundaryAt(new BsonInt32(500))));
		assertNull(plan.from(5).shardFor(pattern.boundaryAt(new BsonInt32(2))));
	}

	@Test
	public void testRejectsUnknownShard() {
		List<PlacementEntry> entries = Arrays.asList(new PlacementEntry(0,
				new KeyRange(pattern.globalMin(), pattern.globalMax()), "z"));
		assertThrows(IllegalArgumentException.class,
				() -> new PlacementPlan(ns, pattern, Arrays.asList("a"), entries, "test"));
	}

	@Test
	public void testRejectsGap() {
		List<PlacementEntry> entries = Arrays.asList(
				new PlacementEntry(0, new KeyRange(pattern.globalMin(), pattern.boundaryAt(new BsonInt32(1))), "a"),
				new PlacementEntry(1, new KeyRange(pattern.boundaryAt(new BsonInt32(2)), pattern.globalMax()), "a"));
		assertThrows(IllegalArgumentException.class,
				() -> new PlacementPlan(ns, pattern, Arrays.asList("a"), entries, "test"));
	}
}
