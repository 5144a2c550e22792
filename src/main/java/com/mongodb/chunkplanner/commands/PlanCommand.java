package com.mongodb.chunkplanner.commands;

import java.util.Map;
import java.util.concurrent.Callable;

import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.bson.BsonValue;

import com.mongodb.chunkplanner.ChunkPlanner;
import com.mongodb.chunkplanner.ChunkPlannerApp;
import com.mongodb.chunkplanner.ChunkPlannerConfig;
import com.mongodb.chunkplanner.cluster.ShardClient;
import com.mongodb.chunkplanner.model.PlacementEntry;
import com.mongodb.chunkplanner.model.PlacementPlan;
import com.mongodb.chunkplanner.model.ShardTopology;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "plan", description = "Compute and print the placement plan without changing the cluster")
public class PlanCommand implements Callable<Integer> {

	@ParentCommand
	private ChunkPlannerApp parent;

	@Option(names = {"--shards"}, split = ",",
			description = "Plan against these shard ids instead of reading them from the cluster")
	private String[] shards;

	@Option(names = {"--route"}, description = "Print the shard that the given primary key value is placed on")
	private String route;

	@Override
	public Integer call() throws Exception {
		ChunkPlannerConfig config = parent.buildConfig();
		PlacementPlan plan;
		if (shards != null && shards.length > 0) {
			ShardTopology topology = ShardTopology.ofIds(shards).select(config.getShardCount());
			plan = new ChunkPlanner(config, null, null).plan(topology);
		} else {
			try (ShardClient client = parent.connect(config)) {
				plan = new ChunkPlanner(config, client, client).plan();
			}
		}

		if (route != null) {
			BsonValue value = toPrimaryValue(config, route);
			String shard = plan.shardFor(plan.getKeyPattern().boundaryAt(value));
			System.out.println(String.format("%s=%s -> %s", config.getPrimaryKeyField(), route,
					shard == null ? "(not in plan)" : shard));
			return shard == null ? ChunkPlannerApp.EXIT_INCOMPLETE : ChunkPlannerApp.EXIT_OK;
		}

		System.out.println(plan);
		for (PlacementEntry entry : plan.getEntries()) {
			System.out.println("  " + entry);
		}
		for (Map.Entry<String, Integer> e : plan.countsByShard().entrySet()) {
			System.out.println(String.format("%-20s %d ranges", e.getKey(), e.getValue()));
		}
		return ChunkPlannerApp.EXIT_OK;
	}

	static BsonValue toPrimaryValue(ChunkPlannerConfig config, String value) {
		if (config.isStringDomain()) {
			return new BsonString(value);
		}
		long v;
		try {
			v = Long.parseLong(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("--route expects an integer " + config.getPrimaryKeyField() + " value, got "
					+ value, e);
		}
		if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) {
			return new BsonInt32((int) v);
		}
		return new BsonInt64(v);
	}
}
