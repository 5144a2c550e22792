package com.mongodb.chunkplanner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Observed per-shard share of a collection's documents (or bytes) and the resulting skew,
 * the spread between the largest and smallest share.
 */
public class DistributionReport {

	private final static double EPSILON = 1e-9;

	private final Namespace namespace;
	private final DistributionMetric metric;
	private final Map<String, Long> counts;
	private final Map<String, Double> shares;
	private final long total;
	private final double skew;
	private final DescriptiveStatistics shareStats;

	public DistributionReport(Namespace namespace, DistributionMetric metric, Map<String, Long> counts) {
		this.namespace = namespace;
		this.metric = metric;
		this.counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
		this.total = counts.values().stream().mapToLong(Long::longValue).sum();

		Map<String, Double> s = new LinkedHashMap<>();
		shareStats = new DescriptiveStatistics();
		for (Map.Entry<String, Long> e : counts.entrySet()) {
			double share = total == 0 ? 0.0 : (double) e.getValue() / total;
			s.put(e.getKey(), share);
			shareStats.addValue(share);
		}
		this.shares = Collections.unmodifiableMap(s);
		if (total == 0) {
			this.skew = 0.0;
		} else {
			long max = counts.values().stream().mapToLong(Long::longValue).max().getAsLong();
			long min = counts.values().stream().mapToLong(Long::longValue).min().getAsLong();
			this.skew = (double) (max - min) / total;
		}
	}

	public Namespace getNamespace() {
		return namespace;
	}

	public DistributionMetric getMetric() {
		return metric;
	}

	public Map<String, Long> getCounts() {
		return counts;
	}

	public Map<String, Double> getShares() {
		return shares;
	}

	public double getShare(String shardId) {
		return shares.getOrDefault(shardId, 0.0);
	}

	public long getTotal() {
		return total;
	}

	public double getSkew() {
		return skew;
	}

	public double getMeanShare() {
		return shares.isEmpty() ? 0.0 : shareStats.getMean();
	}

	public double getShareStandardDeviation() {
		return shares.size() < 2 ? 0.0 : shareStats.getStandardDeviation();
	}

	public boolean isBalanced(double tolerance) {
		return skew <= tolerance + EPSILON;
	}

	public String format() {
		StringBuilder sb = new StringBuilder();
		sb.append(String.format("Distribution of %s by %s, total: %,d%n", namespace, metric.getUnit(), total));
		for (Map.Entry<String, Long> e : counts.entrySet()) {
			sb.append(String.format("  %-20s %,15d  %6.2f %%%n", e.getKey(), e.getValue(), shares.get(e.getKey()) * 100.0));
		}
		sb.append(String.format("  skew: %.4f, mean share: %.4f, stddev: %.4f", skew, getMeanShare(),
				getShareStandardDeviation()));
		return sb.toString();
	}

	@Override
	public String toString() {
		return String.format("DistributionReport{ns=%s, metric=%s, total=%d, shares=%s, skew=%.4f}", namespace, metric,
				total, shares, skew);
	}
}
