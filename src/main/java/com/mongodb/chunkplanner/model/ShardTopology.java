package com.mongodb.chunkplanner.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.mongodb.chunkplanner.EmptyShardSetException;

/**
 * Immutable snapshot of the shards taking part in a planning run, in the order the
 * cluster lists them.
 */
public class ShardTopology {

	private final List<Shard> shards;
	private final Map<String, Shard> shardsById;

	public ShardTopology(Collection<Shard> shards) {
		Map<String, Shard> byId = new LinkedHashMap<>();
		for (Shard shard : shards) {
			if (byId.put(shard.getId(), shard) != null) {
				throw new IllegalArgumentException("Duplicate shard id: " + shard.getId());
			}
		}
		this.shards = ImmutableList.copyOf(byId.values());
		this.shardsById = byId;
	}

	public static ShardTopology ofIds(String... ids) {
		ImmutableList.Builder<Shard> builder = ImmutableList.builder();
		for (String id : ids) {
			builder.add(new Shard(id, null, id));
		}
		return new ShardTopology(builder.build());
	}

	public List<Shard> getShards() {
		return shards;
	}

	public List<String> getShardIds() {
		return shards.stream().map(Shard::getId).collect(ImmutableList.toImmutableList());
	}

	public Shard getShard(String id) {
		return shardsById.get(id);
	}

	public boolean contains(String id) {
		return shardsById.containsKey(id);
	}

	public int size() {
		return shards.size();
	}

	public boolean isEmpty() {
		return shards.isEmpty();
	}

	/**
	 * The first <code>shardCount</code> shards, or all of them when shardCount is 0.
	 */
	public ShardTopology select(int shardCount) {
		if (shards.isEmpty()) {
			throw new EmptyShardSetException("selectShards", "cluster topology has no shards");
		}
		if (shardCount <= 0 || shardCount == shards.size()) {
			return this;
		}
		if (shardCount > shards.size()) {
			throw new EmptyShardSetException("selectShards",
					String.format("%d shards requested but the cluster only has %d: %s", shardCount, shards.size(), getShardIds()));
		}
		return new ShardTopology(shards.subList(0, shardCount));
	}

	@Override
	public String toString() {
		return "ShardTopology" + shards;
	}
}
