package com.mongodb.chunkplanner.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class DistributionReportTest {

	private final static Namespace ns = new Namespace("marketplace", "products");

	@Test
	public void testSharesAndSkew() {
		Map<String, Long> counts = new LinkedHashMap<>();
		counts.put("shard1", 340L);
		counts.put("shard2", 330L);
		counts.put("shard3", 330L);
		DistributionReport report = new DistributionReport(ns, DistributionMetric.COUNT, counts);

		assertEquals(1000, report.getTotal());
		assertEquals(0.34, report.getShare("shard1"), 1e-9);
		assertEquals(0.33, report.getShare("shard2"), 1e-9);
		assertEquals(0.01, report.getSkew(), 1e-9);
		assertEquals(1.0 / 3, report.getMeanShare(), 1e-9);
		assertTrue(report.isBalanced(0.05));
		assertFalse(report.isBalanced(0.005));
	}

	@Test
	public void testEmptyCollection() {
		Map<String, Long> counts = new LinkedHashMap<>();
		counts.put("shard1", 0L);
		counts.put("shard2", 0L);
		DistributionReport report = new DistributionReport(ns, DistributionMetric.COUNT, counts);

		assertEquals(0.0, report.getShare("shard1"), 0.0);
		assertEquals(0.0, report.getSkew(), 0.0);
		assertTrue(report.isBalanced(0.0));
	}

	@Test
	public void testAllOnOneShard() {
		Map<String, Long> counts = new LinkedHashMap<>();
		counts.put("shard1", 500L);
		counts.put("shard2", 0L);
		DistributionReport report = new DistributionReport(ns, DistributionMetric.BYTES, counts);
		assertEquals(1.0, report.getSkew(), 1e-9);
		assertFalse(report.isBalanced(0.05));
	}

	@Test
	public void testSkewEqualToTolerance() {
		Map<String, Long> counts = new LinkedHashMap<>();
		counts.put("shard1", 340L);
		counts.put("shard2", 330L);
		counts.put("shard3", 330L);
		assertTrue(new DistributionReport(ns, DistributionMetric.COUNT, counts).isBalanced(0.01));

		counts = new LinkedHashMap<>();
		counts.put("shard1", 55L);
		counts.put("shard2", 45L);
		DistributionReport report = new DistributionReport(ns, DistributionMetric.COUNT, counts);
		assertTrue(report.isBalanced(0.10));
		assertFalse(report.isBalanced(0.09));
	}
}
