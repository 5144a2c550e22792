package com.mongodb.chunkplanner;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.chunkplanner.assign.ChunkAssigner;
import com.mongodb.chunkplanner.assign.ChunkAssigners;
import com.mongodb.chunkplanner.balancer.BalancerCoordinator;
import com.mongodb.chunkplanner.balancer.BalancerSuspension;
import com.mongodb.chunkplanner.cluster.ClusterControlPlane;
import com.mongodb.chunkplanner.cluster.MetricsSource;
import com.mongodb.chunkplanner.cluster.RetryPolicy;
import com.mongodb.chunkplanner.cluster.TopologyModel;
import com.mongodb.chunkplanner.executor.ExecutionResult;
import com.mongodb.chunkplanner.executor.PlacementExecutor;
import com.mongodb.chunkplanner.model.DistributionReport;
import com.mongodb.chunkplanner.model.KeyRange;
import com.mongodb.chunkplanner.model.Namespace;
import com.mongodb.chunkplanner.model.PlacementPlan;
import com.mongodb.chunkplanner.model.ShardKeyPattern;
import com.mongodb.chunkplanner.model.ShardTopology;
import com.mongodb.chunkplanner.split.RangeSplitter;
import com.mongodb.chunkplanner.verify.DistributionVerifier;

/**
 * Runs the whole pipeline against one collection: read the topology, split the key
 * domain, assign ranges to shards, stop the balancer, apply the plan, start the balancer
 * again and measure the resulting distribution.
 */
public class ChunkPlanner {

	private static Logger logger = LoggerFactory.getLogger(ChunkPlanner.class);

	private final ChunkPlannerConfig config;
	private final Namespace ns;
	private final ShardKeyPattern keyPattern;

	private final TopologyModel topologyModel;
	private final RangeSplitter splitter;
	private final ChunkAssigner assigner;
	private final BalancerCoordinator coordinator;
	private final PlacementExecutor executor;
	private final DistributionVerifier verifier;

	private boolean keepBalancerStopped;
	private int startIndex;

	/**
	 * The control plane and metrics source are only used by the methods that talk to the
	 * cluster; offline planning with {@link #plan(ShardTopology)} works without them.
	 */
	public ChunkPlanner(ChunkPlannerConfig config, ClusterControlPlane controlPlane, MetricsSource metricsSource) {
		this(config, controlPlane, metricsSource, config.toRetryPolicy());
	}

	public ChunkPlanner(ChunkPlannerConfig config, ClusterControlPlane controlPlane, MetricsSource metricsSource,
			RetryPolicy retryPolicy) {
		config.validate();
		this.config = config;
		this.ns = config.toNamespace();
		this.keyPattern = config.toKeyPattern();
		this.topologyModel = new TopologyModel(controlPlane);
		this.splitter = new RangeSplitter(keyPattern);
		this.assigner = ChunkAssigners.forName(config.getAssignmentPolicy(), config.getShardWeights());
		this.coordinator = new BalancerCoordinator(controlPlane, retryPolicy, config.getBalancerDrainTimeoutMs());
		this.executor = new PlacementExecutor(controlPlane, retryPolicy, config.getConcurrency());
		this.verifier = new DistributionVerifier(metricsSource, config.getDistributionMetric());
	}

	/**
	 * Computes the placement plan from the current topology. Touches nothing on the
	 * cluster.
	 */
	public PlacementPlan plan() {
		ShardTopology topology = topologyModel.refresh().select(config.getShardCount());
		return plan(topology);
	}

	public PlacementPlan plan(ShardTopology topology) {
		List<KeyRange> ranges = splitter.split(config.toKeyDomain(), config.getSplitCount());
		PlacementPlan plan = assigner.assign(ns, keyPattern, ranges, topology);
		logger.info("planned {} ranges of {} across {} shards: {}", plan.size(), ns, topology.size(),
				plan.countsByShard());
		return plan;
	}

	public RunSummary run() {
		return run(null);
	}

	/**
	 * @param ingestion optional bulk load, run after placement with the balancer still
	 *                  stopped
	 */
	public RunSummary run(IngestionStep ingestion) {
		PlacementPlan plan = plan();
		if (startIndex > 0) {
			logger.info("resuming at entry {} of {}", startIndex, plan.size());
			plan = plan.from(startIndex);
		}
		ExecutionResult result;
		try (BalancerSuspension suspension = coordinator.suspendScoped()) {
			if (keepBalancerStopped) {
				suspension.keepStopped();
			}
			result = executor.execute(plan);
			if (ingestion != null && !result.isCancelled()) {
				logger.info("running ingestion step with balancer stopped");
				ingest(ingestion, plan);
			}
		}
		if (keepBalancerStopped) {
			logger.warn("balancer left stopped, start it again when the bulk load is done");
		}

		DistributionReport report = null;
		VerificationUnavailableException verificationError = null;
		try {
			report = verifier.verify(ns, plan.getShardIds());
		} catch (VerificationUnavailableException e) {
			logger.warn("distribution could not be verified: {}", e.getMessage());
			verificationError = e;
		}
		RunSummary summary = new RunSummary(plan, result, report, verificationError, config.getTolerance());
		logger.info("{}", summary);
		return summary;
	}

	private void ingest(IngestionStep ingestion, PlacementPlan plan) {
		try {
			ingestion.ingest(plan);
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new ChunkPlannerException("ingest", e.getMessage(), e);
		}
	}

	public DistributionReport verify() {
		ShardTopology topology = topologyModel.refresh().select(config.getShardCount());
		return verifier.verify(ns, topology.getShardIds());
	}

	/**
	 * Polls the distribution until it is within tolerance or the timeout passes.
	 *
	 * @return the last report read
	 */
	public DistributionReport awaitBalanced(long timeoutMs, long pollIntervalMs) throws InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMs;
		DistributionReport report = verify();
		while (!report.isBalanced(config.getTolerance()) && System.currentTimeMillis() < deadline) {
			logger.info("skew {} above tolerance {}, checking again in {} ms", String.format("%.4f", report.getSkew()),
					config.getTolerance(), pollIntervalMs);
			Thread.sleep(pollIntervalMs);
			report = verify();
		}
		return report;
	}

	public void cancel() {
		executor.cancel();
	}

	/**
	 * Skip plan entries before the given index, for resuming a run that is known to have
	 * applied them. Entries that are already in place are skipped anyway.
	 */
	public void setStartIndex(int startIndex) {
		this.startIndex = startIndex;
	}

	public void setKeepBalancerStopped(boolean keepBalancerStopped) {
		this.keepBalancerStopped = keepBalancerStopped;
	}

	public ChunkPlannerConfig getConfig() {
		return config;
	}

	public TopologyModel getTopologyModel() {
		return topologyModel;
	}

	public BalancerCoordinator getCoordinator() {
		return coordinator;
	}
}
