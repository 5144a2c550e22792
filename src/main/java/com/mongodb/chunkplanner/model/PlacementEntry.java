package com.mongodb.chunkplanner.model;

import java.util.Objects;

public class PlacementEntry {

	private final int index;
	private final KeyRange range;
	private final String targetShard;

	public PlacementEntry(int index, KeyRange range, String targetShard) {
		this.index = index;
		this.range = Objects.requireNonNull(range, "range");
		this.targetShard = Objects.requireNonNull(targetShard, "targetShard");
	}

	public int getIndex() {
		return index;
	}

	public KeyRange getRange() {
		return range;
	}

	public String getTargetShard() {
		return targetShard;
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, range, targetShard);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PlacementEntry))
			return false;
		PlacementEntry other = (PlacementEntry) obj;
		return index == other.index && range.equals(other.range) && targetShard.equals(other.targetShard);
	}

	@Override
	public String toString() {
		return String.format("#%d %s -> %s", index, range, targetShard);
	}
}
