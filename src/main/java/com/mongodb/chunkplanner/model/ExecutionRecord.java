package com.mongodb.chunkplanner.model;

import com.mongodb.chunkplanner.PlacementFailedException;

/**
 * Progress of one plan entry during a run. Kept in memory only; a new run recomputes
 * what is left from the cluster's own chunk metadata.
 */
public class ExecutionRecord {

	private final PlacementEntry entry;

	private volatile EntryStatus status = EntryStatus.PENDING;
	private volatile boolean splitIssued;
	private volatile boolean moveIssued;
	private volatile int attempts;
	private volatile PlacementFailedException failure;

	public ExecutionRecord(PlacementEntry entry) {
		this.entry = entry;
	}

	public PlacementEntry getEntry() {
		return entry;
	}

	public EntryStatus getStatus() {
		return status;
	}

	public void splitDone(boolean issued) {
		this.splitIssued = issued;
		this.status = EntryStatus.SPLIT_DONE;
	}

	public void moved(boolean issued) {
		this.moveIssued = issued;
		this.status = EntryStatus.MOVED;
	}

	public void failed(PlacementFailedException failure) {
		this.failure = failure;
		this.status = EntryStatus.FAILED;
	}

	public void addAttempts(int count) {
		this.attempts += count;
	}

	public boolean isSplitIssued() {
		return splitIssued;
	}

	public boolean isMoveIssued() {
		return moveIssued;
	}

	/**
	 * Completed without issuing any cluster operation, everything was already in place.
	 */
	public boolean isAlreadyApplied() {
		return status == EntryStatus.MOVED && !splitIssued && !moveIssued;
	}

	public int getAttempts() {
		return attempts;
	}

	public PlacementFailedException getFailure() {
		return failure;
	}

	@Override
	public String toString() {
		return String.format("ExecutionRecord{entry=%d, status=%s, split=%s, move=%s, attempts=%d}", entry.getIndex(),
				status, splitIssued, moveIssued, attempts);
	}
}
