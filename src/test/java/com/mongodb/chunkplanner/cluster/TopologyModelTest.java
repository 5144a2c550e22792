package com.mongodb.chunkplanner.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.mongodb.chunkplanner.model.ShardKeyPattern;
import com.mongodb.chunkplanner.model.ShardTopology;

public class TopologyModelTest {

	@Test
	public void testSnapshotChangesOnlyOnRefresh() {
		InMemoryCluster cluster = new InMemoryCluster(new ShardKeyPattern("category_id", "product_id"), "shard0",
				"shard1");
		TopologyModel model = new TopologyModel(cluster);

		ShardTopology first = model.current();
		assertEquals(Arrays.asList("shard0", "shard1"), first.getShardIds());

		cluster.addShard("shard2");
		assertSame(first, model.current());

		ShardTopology refreshed = model.refresh();
		assertEquals(3, refreshed.size());
		assertSame(refreshed, model.current());
		assertEquals(2, first.size());
	}
}
