package com.mongodb.chunkplanner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Arrays;

import org.bson.BsonInt32;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.mongodb.chunkplanner.cluster.InMemoryCluster;
import com.mongodb.chunkplanner.cluster.RetryPolicy;
import com.mongodb.chunkplanner.model.DistributionReport;
import com.mongodb.chunkplanner.model.PlacementPlan;
import com.mongodb.chunkplanner.model.ShardKeyPattern;

public class ChunkPlannerTest {

	private InMemoryCluster cluster;
	private ChunkPlannerConfig config;
	private RetryPolicy retryPolicy;

	@BeforeEach
	public void setUp() {
		config = new ChunkPlannerConfig();
		config.setShardCount(3);
		cluster = new InMemoryCluster(config.toKeyPattern(), "shard1", "shard2", "shard3", "shard4");
		retryPolicy = new RetryPolicy(3, 0, 0);
	}

	private ChunkPlanner planner() {
		return new ChunkPlanner(config, cluster, cluster, retryPolicy);
	}

	private void insertCatalog() {
		for (int category = 0; category < 100; category++) {
			cluster.insertDocuments(new BsonInt32(category), 10);
		}
	}

	@Test
	public void testPlanUsesFirstShards() {
		PlacementPlan plan = planner().plan();
		assertEquals(99, plan.size());
		assertEquals(Arrays.asList("shard1", "shard2", "shard3"), plan.getShardIds());
		assertEquals(33, plan.countsByShard().get("shard3").intValue());
		assertTrue(cluster.getChunks().size() == 1);
	}

	@Test
	public void testRunPlacesAndVerifies() {
		insertCatalog();
		RunSummary summary = planner().run();

		assertEquals(0, summary.getFailedCount());
		assertEquals(0, summary.getCancelledCount());
		DistributionReport report = summary.getReport();
		assertNotNull(report);
		// the last range holds categories 98 and 99
		assertEquals(330, report.getCounts().get("shard1").longValue());
		assertEquals(330, report.getCounts().get("shard2").longValue());
		assertEquals(340, report.getCounts().get("shard3").longValue());
		assertEquals(0.01, report.getSkew(), 1e-9);
		assertTrue(summary.isBalanced());
		assertTrue(summary.isSuccessful());
		assertTrue(cluster.isBalancerEnabled());
		assertEquals(Arrays.asList(false, true), cluster.getBalancerStateChanges());
		assertTrue(summary.format().contains("BALANCED"));
	}

	@Test
	public void testSecondRunIsNoop() {
		planner().run();
		int moves = cluster.getMoveCount();
		int splits = cluster.getSplitCount();

		RunSummary again = planner().run();

		assertEquals(99, again.getSkippedCount());
		assertEquals(0, again.getMovedCount());
		assertEquals(moves, cluster.getMoveCount());
		assertEquals(splits, cluster.getSplitCount());
	}

	@Test
	public void testIngestionRunsWithBalancerStopped() {
		RunSummary summary = planner().run(plan -> {
			assertFalse(cluster.isBalancerEnabled());
			insertCatalog();
		});
		assertEquals(1000, summary.getReport().getTotal());
		assertTrue(cluster.isBalancerEnabled());
	}

	@Test
	public void testKeepBalancerStopped() {
		ChunkPlanner planner = planner();
		planner.setKeepBalancerStopped(true);
		planner.run();
		assertFalse(cluster.isBalancerEnabled());
	}

	@Test
	public void testIngestionFailureResumesBalancer() {
		ChunkPlannerException e = assertThrows(ChunkPlannerException.class, () -> planner().run(plan -> {
			throw new IOException("import failed");
		}));
		assertEquals("ingest", e.getOperation());
		assertTrue(cluster.isBalancerEnabled());
	}

	@Test
	public void testFailedEntryReported() {
		insertCatalog();
		ShardKeyPattern pattern = config.toKeyPattern();
		cluster.failMoveAt(pattern.boundaryAt(new BsonInt32(5)), -1, InMemoryCluster::socketError);

		RunSummary summary = planner().run();

		assertEquals(1, summary.getFailedCount());
		assertEquals(5, summary.getFailures().get(0).getEntry().getIndex());
		assertFalse(summary.isSuccessful());
		assertNotNull(summary.getReport());
		assertTrue(cluster.isBalancerEnabled());
	}

	@Test
	public void testVerificationUnavailable() {
		cluster.failMetrics(InMemoryCluster.commandError(13, "Unauthorized"));
		RunSummary summary = planner().run();

		assertNull(summary.getReport());
		assertNotNull(summary.getVerificationError());
		assertEquals(0, summary.getFailedCount());
		assertFalse(summary.isBalanced());
		assertTrue(summary.format().contains("distribution unavailable"));
	}

	@Test
	public void testBalancerFailureIsFatal() {
		cluster.failBalancerCalls(-1, InMemoryCluster::socketError);
		assertThrows(BalancerStateException.class, () -> planner().run());
		assertEquals(0, cluster.getMoveCount());
		assertEquals(0, cluster.getSplitCount());
	}

	@Test
	public void testSuspendFailureRestartsBalancer() {
		insertCatalog();
		config.setBalancerDrainTimeoutMs(0);
		cluster.setBalancerRoundsRemaining(Integer.MAX_VALUE);
		assertThrows(BalancerStateException.class, () -> planner().run());
		assertTrue(cluster.isBalancerEnabled());
		assertEquals(Arrays.asList(false, true), cluster.getBalancerStateChanges());
		assertEquals(0, cluster.getMoveCount());
	}

	@Test
	public void testTooFewShards() {
		config.setShardCount(5);
		assertThrows(EmptyShardSetException.class, () -> planner().plan());
	}

	@Test
	public void testAwaitBalanced() throws Exception {
		insertCatalog();
		ChunkPlanner planner = planner();
		planner.run();
		DistributionReport report = planner.awaitBalanced(0, 1);
		assertTrue(report.isBalanced(config.getTolerance()));
	}
}
