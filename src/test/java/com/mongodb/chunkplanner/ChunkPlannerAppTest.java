package com.mongodb.chunkplanner;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class ChunkPlannerAppTest {

	private static int run(String... args) {
		return ChunkPlannerApp.commandLine().execute(args);
	}

	@Test
	public void testOfflinePlan() {
		assertEquals(ChunkPlannerApp.EXIT_OK, run("--config", "does-not-exist.properties", "plan", "--shards",
				"shard1,shard2,shard3"));
	}

	@Test
	public void testOfflineRoute() {
		assertEquals(ChunkPlannerApp.EXIT_OK, run("--config", "does-not-exist.properties", "--splitCount", "10",
				"plan", "--shards", "shard1,shard2", "--route", "7"));
	}

	@Test
	public void testInvalidOptionIsUsageError() {
		assertEquals(ChunkPlannerApp.EXIT_ERROR, run("--config", "does-not-exist.properties", "--tolerance", "2",
				"plan", "--shards", "shard1"));
	}

	@Test
	public void testSourceRequiredForClusterCommands() {
		assertEquals(ChunkPlannerApp.EXIT_ERROR, run("--config", "does-not-exist.properties", "verify"));
	}

	@Test
	public void testNoSubcommand() {
		assertEquals(ChunkPlannerApp.EXIT_ERROR, run("--config", "does-not-exist.properties"));
	}
}
