package com.mongodb.chunkplanner.commands;

import java.util.concurrent.Callable;

import com.mongodb.chunkplanner.ChunkPlanner;
import com.mongodb.chunkplanner.ChunkPlannerApp;
import com.mongodb.chunkplanner.ChunkPlannerConfig;
import com.mongodb.chunkplanner.balancer.BalancerCoordinator;
import com.mongodb.chunkplanner.cluster.ShardClient;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "balancer", description = "Show, stop or start the cluster balancer")
public class BalancerCommand implements Callable<Integer> {

	enum Action {
		status, stop, start
	}

	@ParentCommand
	private ChunkPlannerApp parent;

	@Parameters(index = "0", description = "One of: ${COMPLETION-CANDIDATES}", defaultValue = "status")
	private Action action;

	@Override
	public Integer call() throws Exception {
		ChunkPlannerConfig config = parent.buildConfig();
		try (ShardClient client = parent.connect(config)) {
			BalancerCoordinator coordinator = new ChunkPlanner(config, client, client).getCoordinator();
			switch (action) {
			case stop:
				coordinator.suspend();
				break;
			case start:
				coordinator.resume();
				break;
			default:
				break;
			}
			System.out.println("balancer " + (coordinator.isBalancerEnabled() ? "enabled" : "stopped"));
			return ChunkPlannerApp.EXIT_OK;
		}
	}
}
