package com.mongodb.chunkplanner;

import java.util.List;
import java.util.Map;

import com.mongodb.chunkplanner.executor.ExecutionResult;
import com.mongodb.chunkplanner.model.DistributionReport;
import com.mongodb.chunkplanner.model.PlacementPlan;

/**
 * Outcome of a complete run: what the executor did, and the distribution measured
 * afterwards (or why it could not be measured).
 */
public class RunSummary {

	private final PlacementPlan plan;
	private final ExecutionResult executionResult;
	private final DistributionReport report;
	private final VerificationUnavailableException verificationError;
	private final double tolerance;

	public RunSummary(PlacementPlan plan, ExecutionResult executionResult, DistributionReport report,
			VerificationUnavailableException verificationError, double tolerance) {
		this.plan = plan;
		this.executionResult = executionResult;
		this.report = report;
		this.verificationError = verificationError;
		this.tolerance = tolerance;
	}

	public PlacementPlan getPlan() {
		return plan;
	}

	public ExecutionResult getExecutionResult() {
		return executionResult;
	}

	public DistributionReport getReport() {
		return report;
	}

	public VerificationUnavailableException getVerificationError() {
		return verificationError;
	}

	public int getSplitCount() {
		return executionResult.getSplitCount();
	}

	public int getMovedCount() {
		return executionResult.getMovedCount();
	}

	public int getFailedCount() {
		return executionResult.getFailedCount();
	}

	public int getSkippedCount() {
		return executionResult.getSkippedCount();
	}

	public int getCancelledCount() {
		return executionResult.getCancelledCount();
	}

	public List<PlacementFailedException> getFailures() {
		return executionResult.getFailures();
	}

	public boolean isBalanced() {
		return report != null && report.isBalanced(tolerance);
	}

	/**
	 * Every entry applied and the measured distribution within tolerance.
	 */
	public boolean isSuccessful() {
		return getFailedCount() == 0 && getCancelledCount() == 0 && isBalanced();
	}

	public String format() {
		StringBuilder sb = new StringBuilder();
		sb.append(String.format("Run summary for %s, %d entries (%s)%n", plan.getNamespace(), plan.size(),
				plan.getPolicyName()));
		sb.append(String.format("  split: %d, moved: %d, failed: %d, skipped: %d, cancelled: %d%n", getSplitCount(),
				getMovedCount(), getFailedCount(), getSkippedCount(), getCancelledCount()));
		sb.append("  planned ranges per shard:");
		for (Map.Entry<String, Integer> e : plan.countsByShard().entrySet()) {
			sb.append(String.format(" %s=%d", e.getKey(), e.getValue()));
		}
		sb.append(String.format("%n"));
		for (PlacementFailedException failure : getFailures()) {
			sb.append("  FAILED ").append(failure.getMessage()).append(String.format("%n"));
		}
		if (report != null) {
			sb.append(report.format()).append(String.format("%n"));
			sb.append(String.format("  %s (tolerance %.4f)", isBalanced() ? "BALANCED" : "NOT BALANCED", tolerance));
		} else {
			sb.append("  distribution unavailable: ").append(verificationError.getMessage());
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return String.format("RunSummary{%s, balanced=%s}", executionResult, isBalanced());
	}
}
