package com.mongodb.chunkplanner.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.BsonDocument;

import com.google.common.collect.ImmutableList;
import com.mongodb.chunkplanner.util.ShardKeyComparator;

/**
 * Ordered, immutable list of range to shard assignments for one collection. A plan is
 * the unit of execution; any suffix of it ({@link #from(int)}) can be executed on its
 * own to resume a partially applied run.
 */
public class PlacementPlan {

	private final Namespace namespace;
	private final ShardKeyPattern keyPattern;
	private final List<String> shardIds;
	private final List<PlacementEntry> entries;
	private final String policyName;

	public PlacementPlan(Namespace namespace, ShardKeyPattern keyPattern, List<String> shardIds,
			List<PlacementEntry> entries, String policyName) {
		this.namespace = namespace;
		this.keyPattern = keyPattern;
		this.shardIds = ImmutableList.copyOf(shardIds);
		this.entries = ImmutableList.copyOf(entries);
		this.policyName = policyName;
		validate();
	}

	private void validate() {
		for (int i = 0; i < entries.size(); i++) {
			PlacementEntry entry = entries.get(i);
			if (!shardIds.contains(entry.getTargetShard())) {
				throw new IllegalArgumentException("entry " + entry + " targets unknown shard " + entry.getTargetShard());
			}
			if (i == 0) {
				continue;
			}
			PlacementEntry prev = entries.get(i - 1);
			if (entry.getIndex() != prev.getIndex() + 1) {
				throw new IllegalArgumentException(
						String.format("plan entries out of order, %d follows %d", entry.getIndex(), prev.getIndex()));
			}
			if (!prev.getRange().getUpperBound().equals(entry.getRange().getLowerBound())) {
				throw new IllegalArgumentException(
						String.format("plan ranges not contiguous between entries %d and %d: %s / %s", prev.getIndex(),
								entry.getIndex(), prev.getRange(), entry.getRange()));
			}
		}
	}

	public Namespace getNamespace() {
		return namespace;
	}

	public ShardKeyPattern getKeyPattern() {
		return keyPattern;
	}

	public List<String> getShardIds() {
		return shardIds;
	}

	public List<PlacementEntry> getEntries() {
		return entries;
	}

	public String getPolicyName() {
		return policyName;
	}

	public int size() {
		return entries.size();
	}

	public PlacementEntry getEntry(int index) {
		if (entries.isEmpty()) {
			throw new IndexOutOfBoundsException("empty plan");
		}
		return entries.get(index - entries.get(0).getIndex());
	}

	/**
	 * The remainder of this plan starting at the entry with the given index.
	 */
	public PlacementPlan from(int index) {
		int offset = entries.isEmpty() ? 0 : index - entries.get(0).getIndex();
		if (offset < 0 || offset > entries.size()) {
			throw new IndexOutOfBoundsException("no plan entry with index " + index);
		}
		return new PlacementPlan(namespace, keyPattern, shardIds, entries.subList(offset, entries.size()), policyName);
	}

	/**
	 * Number of ranges per shard, in shard order, including shards that received none.
	 */
	public Map<String, Integer> countsByShard() {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (String shardId : shardIds) {
			counts.put(shardId, 0);
		}
		for (PlacementEntry entry : entries) {
			counts.merge(entry.getTargetShard(), 1, Integer::sum);
		}
		return counts;
	}

	/**
	 * Shard the plan places the given shard key on, or null if the key falls outside
	 * the planned ranges.
	 */
	public String shardFor(BsonDocument key) {
		int lo = 0;
		int hi = entries.size() - 1;
		ShardKeyComparator c = ShardKeyComparator.INSTANCE;
		while (lo <= hi) {
			int mid = (lo + hi) >>> 1;
			KeyRange range = entries.get(mid).getRange();
			if (range.contains(key)) {
				return entries.get(mid).getTargetShard();
			}
			if (c.compareDocs(key, range.getLowerBound()) < 0) {
				hi = mid - 1;
			} else {
				lo = mid + 1;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return String.format("PlacementPlan{ns=%s, key=%s, policy=%s, entries=%d, shards=%s}", namespace, keyPattern,
				policyName, entries.size(), countsByShard());
	}
}
