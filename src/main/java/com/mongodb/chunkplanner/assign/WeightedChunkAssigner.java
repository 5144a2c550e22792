package com.mongodb.chunkplanner.assign;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Smooth weighted round robin for shards of unequal capacity. On every pick each shard's
 * running score grows by its weight, the highest score wins (first shard on ties) and is
 * reduced by the total weight. Over a cycle of sum(weights) ranges each shard receives
 * exactly its weight, interleaved rather than in runs. Equal weights give the plain
 * round robin plan.
 */
public class WeightedChunkAssigner extends AbstractChunkAssigner {

	public static final String NAME = "weighted";

	private final Map<String, Integer> weights;

	public WeightedChunkAssigner(Map<String, Integer> weights) {
		for (Map.Entry<String, Integer> e : weights.entrySet()) {
			if (e.getValue() == null || e.getValue() < 1) {
				throw new IllegalArgumentException("weight for shard " + e.getKey() + " must be >= 1, was " + e.getValue());
			}
		}
		this.weights = Collections.unmodifiableMap(new HashMap<>(weights));
	}

	@Override
	public String getName() {
		return NAME;
	}

	/**
	 * Shards without a configured weight count as 1.
	 */
	public int getWeight(String shardId) {
		return weights.getOrDefault(shardId, 1);
	}

	@Override
	protected List<String> targetShards(int rangeCount, List<String> shardIds) {
		int[] shardWeights = new int[shardIds.size()];
		long total = 0;
		for (int i = 0; i < shardIds.size(); i++) {
			shardWeights[i] = getWeight(shardIds.get(i));
			total += shardWeights[i];
		}

		long[] scores = new long[shardIds.size()];
		List<String> targets = new ArrayList<>(rangeCount);
		for (int r = 0; r < rangeCount; r++) {
			int best = 0;
			for (int i = 0; i < scores.length; i++) {
				scores[i] += shardWeights[i];
				if (scores[i] > scores[best]) {
					best = i;
				}
			}
			scores[best] -= total;
			targets.add(shardIds.get(best));
		}
		return targets;
	}

	@Override
	public String toString() {
		return "WeightedChunkAssigner" + weights;
	}
}
