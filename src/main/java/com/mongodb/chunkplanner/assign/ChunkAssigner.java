package com.mongodb.chunkplanner.assign;

import java.util.List;

import com.mongodb.chunkplanner.model.KeyRange;
import com.mongodb.chunkplanner.model.Namespace;
import com.mongodb.chunkplanner.model.PlacementPlan;
import com.mongodb.chunkplanner.model.ShardKeyPattern;
import com.mongodb.chunkplanner.model.ShardTopology;

/**
 * Policy that decides which shard each key range is placed on. Implementations are pure
 * functions of their inputs: the same ranges and shards always give the same plan.
 */
public interface ChunkAssigner {

	/**
	 * @return the policy name used in configuration, e.g. "roundRobin"
	 */
	String getName();

	/**
	 * @throws com.mongodb.chunkplanner.EmptyShardSetException if the topology has no shards
	 */
	PlacementPlan assign(Namespace ns, ShardKeyPattern keyPattern, List<KeyRange> ranges, ShardTopology shards);
}
