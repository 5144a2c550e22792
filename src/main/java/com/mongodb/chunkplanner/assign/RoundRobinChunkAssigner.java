package com.mongodb.chunkplanner.assign;

import java.util.ArrayList;
import java.util.List;

/**
 * Range i goes to shard i mod S. Every shard ends up with floor(K/S) or ceil(K/S) ranges.
 */
public class RoundRobinChunkAssigner extends AbstractChunkAssigner {

	public static final String NAME = "roundRobin";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	protected List<String> targetShards(int rangeCount, List<String> shardIds) {
		List<String> targets = new ArrayList<>(rangeCount);
		for (int i = 0; i < rangeCount; i++) {
			targets.add(shardIds.get(i % shardIds.size()));
		}
		return targets;
	}
}
