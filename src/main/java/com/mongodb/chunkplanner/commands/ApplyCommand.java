package com.mongodb.chunkplanner.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.chunkplanner.ChunkPlanner;
import com.mongodb.chunkplanner.ChunkPlannerApp;
import com.mongodb.chunkplanner.ChunkPlannerConfig;
import com.mongodb.chunkplanner.RunSummary;
import com.mongodb.chunkplanner.cluster.ShardClient;
import com.mongodb.chunkplanner.model.DistributionReport;
import com.mongodb.chunkplanner.model.Namespace;
import com.mongodb.chunkplanner.model.PlacementPlan;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "apply", description = "Split and place the chunks, then verify the distribution")
public class ApplyCommand implements Callable<Integer> {

	private static Logger logger = LoggerFactory.getLogger(ApplyCommand.class);

	@ParentCommand
	private ChunkPlannerApp parent;

	@Option(names = {"--dryRun"}, description = "Compute and log the plan but don't change the cluster")
	private boolean dryRun;

	@Option(names = {"--keepBalancerStopped"},
			description = "Leave the balancer stopped afterwards, for an external bulk import")
	private boolean keepBalancerStopped;

	@Option(names = {"--shardCollection"}, description = "Shard the collection first if it is not sharded yet")
	private boolean shardCollection;

	@Option(names = {"--fromIndex"}, description = "Start at this plan entry, default: ${DEFAULT-VALUE}",
			defaultValue = "0")
	private int fromIndex;

	@Option(names = {"--waitSeconds"}, description = "Wait up to this long for the distribution to be balanced",
			defaultValue = "0")
	private long waitSeconds;

	@Override
	public Integer call() throws Exception {
		ChunkPlannerConfig config = parent.buildConfig();
		try (ShardClient client = parent.connect(config)) {
			ChunkPlanner planner = new ChunkPlanner(config, client, client);

			if (dryRun) {
				PlacementPlan plan = planner.plan();
				logger.info("dry run, {}", plan);
				System.out.println(plan);
				return ChunkPlannerApp.EXIT_OK;
			}

			Namespace ns = config.toNamespace();
			if (shardCollection && !client.isSharded(ns)) {
				client.enableSharding(ns.getDatabaseName());
				client.shardCollection(ns, config.toKeyPattern());
			}

			planner.setKeepBalancerStopped(keepBalancerStopped);
			planner.setStartIndex(fromIndex);

			CountDownLatch done = new CountDownLatch(1);
			Thread shutdownHook = new Thread(() -> {
				System.out.println();
				System.out.println("**** SHUTDOWN *****");
				planner.cancel();
				try {
					done.await(config.getOperationTimeoutMs(), TimeUnit.MILLISECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			});
			Runtime.getRuntime().addShutdownHook(shutdownHook);

			RunSummary summary;
			try {
				summary = planner.run();
			} finally {
				done.countDown();
			}
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
			System.out.println(summary.format());

			boolean balanced = summary.isBalanced();
			if (!balanced && waitSeconds > 0 && summary.getReport() != null) {
				DistributionReport report = planner.awaitBalanced(TimeUnit.SECONDS.toMillis(waitSeconds),
						VerifyCommand.POLL_INTERVAL_MS);
				System.out.println(report.format());
				balanced = report.isBalanced(config.getTolerance());
			}
			return summary.getFailedCount() == 0 && summary.getCancelledCount() == 0 && balanced
					? ChunkPlannerApp.EXIT_OK
					: ChunkPlannerApp.EXIT_INCOMPLETE;
		}
	}
}
