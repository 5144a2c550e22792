package com.mongodb.chunkplanner.assign;

import java.util.Map;

public class ChunkAssigners {

	private ChunkAssigners() {
	}

	public static ChunkAssigner forName(String name, Map<String, Integer> weights) {
		if (name == null || RoundRobinChunkAssigner.NAME.equalsIgnoreCase(name)) {
			return new RoundRobinChunkAssigner();
		} else if (WeightedChunkAssigner.NAME.equalsIgnoreCase(name)) {
			return new WeightedChunkAssigner(weights);
		}
		throw new IllegalArgumentException(
				String.format("Unknown assignmentPolicy '%s', expecting %s or %s", name, RoundRobinChunkAssigner.NAME,
						WeightedChunkAssigner.NAME));
	}
}
