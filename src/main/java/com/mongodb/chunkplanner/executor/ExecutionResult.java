package com.mongodb.chunkplanner.executor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import com.mongodb.chunkplanner.PlacementFailedException;
import com.mongodb.chunkplanner.model.EntryStatus;
import com.mongodb.chunkplanner.model.ExecutionRecord;

/**
 * Per-entry outcome of one executor run, in plan order.
 */
public class ExecutionResult {

	private final List<ExecutionRecord> records;
	private final boolean cancelled;

	public ExecutionResult(List<ExecutionRecord> records, boolean cancelled) {
		this.records = Collections.unmodifiableList(new ArrayList<>(records));
		this.cancelled = cancelled;
	}

	public List<ExecutionRecord> getRecords() {
		return records;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	/**
	 * Number of split commands actually issued.
	 */
	public int getSplitCount() {
		return count(ExecutionRecord::isSplitIssued);
	}

	/**
	 * Number of move commands actually issued.
	 */
	public int getMovedCount() {
		return count(ExecutionRecord::isMoveIssued);
	}

	public int getFailedCount() {
		return count(r -> r.getStatus() == EntryStatus.FAILED);
	}

	/**
	 * Entries that were already in place, no command issued.
	 */
	public int getSkippedCount() {
		return count(ExecutionRecord::isAlreadyApplied);
	}

	/**
	 * Entries never started because the run was cancelled.
	 */
	public int getCancelledCount() {
		return count(r -> r.getStatus() == EntryStatus.PENDING);
	}

	public int getCompletedCount() {
		return count(r -> r.getStatus() == EntryStatus.MOVED);
	}

	public List<PlacementFailedException> getFailures() {
		List<PlacementFailedException> failures = new ArrayList<>();
		for (ExecutionRecord record : records) {
			if (record.getFailure() != null) {
				failures.add(record.getFailure());
			}
		}
		return failures;
	}

	private int count(Predicate<ExecutionRecord> predicate) {
		int count = 0;
		for (ExecutionRecord record : records) {
			if (predicate.test(record)) {
				count++;
			}
		}
		return count;
	}

	@Override
	public String toString() {
		return String.format("split: %d, moved: %d, failed: %d, skipped: %d, cancelled: %d", getSplitCount(),
				getMovedCount(), getFailedCount(), getSkippedCount(), getCancelledCount());
	}
}
