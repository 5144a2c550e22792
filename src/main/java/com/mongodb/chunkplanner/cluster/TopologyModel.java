package com.mongodb.chunkplanner.cluster;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.chunkplanner.model.ShardTopology;

/**
 * Holds the shard membership used for planning. Readers get an immutable snapshot;
 * {@link #refresh()} is the only way the snapshot changes.
 */
public class TopologyModel {

	private static Logger logger = LoggerFactory.getLogger(TopologyModel.class);

	private final ClusterControlPlane controlPlane;
	private final AtomicReference<ShardTopology> current = new AtomicReference<>();

	public TopologyModel(ClusterControlPlane controlPlane) {
		this.controlPlane = controlPlane;
	}

	public ShardTopology refresh() {
		ShardTopology topology = new ShardTopology(controlPlane.listShards());
		ShardTopology previous = current.getAndSet(topology);
		if (previous == null) {
			logger.info("topology loaded, {} shards: {}", topology.size(), topology.getShardIds());
		} else if (!previous.getShards().equals(topology.getShards())) {
			logger.info("topology changed, {} shards: {} (was {})", topology.size(), topology.getShardIds(),
					previous.getShardIds());
		}
		return topology;
	}

	/**
	 * The last refreshed snapshot, loading it on first use.
	 */
	public ShardTopology current() {
		ShardTopology topology = current.get();
		return topology != null ? topology : refresh();
	}
}
