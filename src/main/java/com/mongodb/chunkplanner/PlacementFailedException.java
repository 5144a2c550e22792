package com.mongodb.chunkplanner;

import com.mongodb.chunkplanner.model.PlacementEntry;

/**
 * A single plan entry could not be applied. Recorded against the entry, the rest of the
 * plan keeps going.
 */
public class PlacementFailedException extends ChunkPlannerException {

	private static final long serialVersionUID = 1L;

	private final transient PlacementEntry entry;
	private final int attempts;

	public PlacementFailedException(String operation, PlacementEntry entry, int attempts, Throwable cause) {
		super(operation, String.format("entry %d %s -> %s failed after %d attempt(s): %s", entry.getIndex(),
				entry.getRange(), entry.getTargetShard(), attempts, cause.getMessage()), cause);
		this.entry = entry;
		this.attempts = attempts;
	}

	public PlacementEntry getEntry() {
		return entry;
	}

	public int getAttempts() {
		return attempts;
	}
}
