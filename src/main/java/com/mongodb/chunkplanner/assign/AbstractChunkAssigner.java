package com.mongodb.chunkplanner.assign;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.chunkplanner.EmptyShardSetException;
import com.mongodb.chunkplanner.model.KeyRange;
import com.mongodb.chunkplanner.model.Namespace;
import com.mongodb.chunkplanner.model.PlacementEntry;
import com.mongodb.chunkplanner.model.PlacementPlan;
import com.mongodb.chunkplanner.model.ShardKeyPattern;
import com.mongodb.chunkplanner.model.ShardTopology;

public abstract class AbstractChunkAssigner implements ChunkAssigner {

	protected static Logger logger = LoggerFactory.getLogger(ChunkAssigner.class);

	@Override
	public PlacementPlan assign(Namespace ns, ShardKeyPattern keyPattern, List<KeyRange> ranges, ShardTopology shards) {
		if (shards == null || shards.isEmpty()) {
			throw new EmptyShardSetException("assign", "no shards available to assign " + ranges.size() + " ranges");
		}
		List<String> shardIds = shards.getShardIds();
		List<String> targets = targetShards(ranges.size(), shardIds);
		List<PlacementEntry> entries = new ArrayList<>(ranges.size());
		for (int i = 0; i < ranges.size(); i++) {
			entries.add(new PlacementEntry(i, ranges.get(i), targets.get(i)));
		}
		PlacementPlan plan = new PlacementPlan(ns, keyPattern, shardIds, entries, getName());
		logger.debug("{} assigned {} ranges: {}", getName(), ranges.size(), plan.countsByShard());
		return plan;
	}

	/**
	 * @return the target shard id for each of <code>rangeCount</code> ranges, in range order
	 */
	protected abstract List<String> targetShards(int rangeCount, List<String> shardIds);
}
