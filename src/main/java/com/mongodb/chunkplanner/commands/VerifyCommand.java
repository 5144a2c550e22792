package com.mongodb.chunkplanner.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import com.mongodb.chunkplanner.ChunkPlanner;
import com.mongodb.chunkplanner.ChunkPlannerApp;
import com.mongodb.chunkplanner.ChunkPlannerConfig;
import com.mongodb.chunkplanner.cluster.ShardClient;
import com.mongodb.chunkplanner.model.DistributionReport;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "verify", description = "Report the per-shard distribution of the collection")
public class VerifyCommand implements Callable<Integer> {

	static final long POLL_INTERVAL_MS = 10000;

	@ParentCommand
	private ChunkPlannerApp parent;

	@Option(names = {"--waitSeconds"}, description = "Poll until balanced for up to this many seconds",
			defaultValue = "0")
	private long waitSeconds;

	@Override
	public Integer call() throws Exception {
		ChunkPlannerConfig config = parent.buildConfig();
		try (ShardClient client = parent.connect(config)) {
			ChunkPlanner planner = new ChunkPlanner(config, client, client);
			DistributionReport report = waitSeconds > 0
					? planner.awaitBalanced(TimeUnit.SECONDS.toMillis(waitSeconds), POLL_INTERVAL_MS)
					: planner.verify();
			boolean balanced = report.isBalanced(config.getTolerance());
			System.out.println(report.format());
			System.out.println(String.format("%s (tolerance %.4f)", balanced ? "BALANCED" : "NOT BALANCED",
					config.getTolerance()));
			return balanced ? ChunkPlannerApp.EXIT_OK : ChunkPlannerApp.EXIT_INCOMPLETE;
		}
	}
}
