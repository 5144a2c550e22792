package com.mongodb.chunkplanner.executor;

import java.util.Collections;
import java.util.Set;

import org.bson.BsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.MongoException;
import com.mongodb.chunkplanner.PlacementFailedException;
import com.mongodb.chunkplanner.cluster.ClusterControlPlane;
import com.mongodb.chunkplanner.cluster.RetriesExhaustedException;
import com.mongodb.chunkplanner.cluster.RetryPolicy;
import com.mongodb.chunkplanner.model.ExecutionRecord;
import com.mongodb.chunkplanner.model.KeyRange;
import com.mongodb.chunkplanner.model.Namespace;
import com.mongodb.chunkplanner.model.PlacementEntry;

/**
 * Applies one plan entry: split at the range's lower bound, then move the range to its
 * target shard. Each step first checks the cluster's chunk metadata and is skipped when
 * it is already in place.
 */
class PlacementTask implements Runnable {

	private static Logger logger = LoggerFactory.getLogger(PlacementTask.class);

	private final ClusterControlPlane controlPlane;
	private final RetryPolicy retryPolicy;
	private final Namespace ns;
	private final ExecutionRecord record;

	PlacementTask(ClusterControlPlane controlPlane, RetryPolicy retryPolicy, Namespace ns, ExecutionRecord record) {
		this.controlPlane = controlPlane;
		this.retryPolicy = retryPolicy;
		this.ns = ns;
		this.record = record;
	}

	@Override
	public void run() {
		PlacementEntry entry = record.getEntry();
		String operation = "split";
		try {
			record.splitDone(split(entry.getRange()));
			operation = "moveRange";
			record.moved(move(entry.getRange(), entry.getTargetShard()));
			logger.debug("{} {}", entry, record.isAlreadyApplied() ? "already in place" : "applied");
		} catch (RetriesExhaustedException e) {
			PlacementFailedException failure = new PlacementFailedException(operation, entry, e.getAttempts(),
					e.getCause());
			logger.error(failure.getMessage());
			record.failed(failure);
		} catch (RuntimeException e) {
			PlacementFailedException failure = new PlacementFailedException(operation, entry, 1, e);
			logger.error(failure.getMessage(), e);
			record.failed(failure);
		}
	}

	private boolean split(KeyRange range) throws RetriesExhaustedException {
		if (range.isGlobalMin()) {
			return false;
		}
		BsonDocument boundary = range.getLowerBound();
		return retryPolicy.call("split " + boundary.toJson(), () -> {
			if (controlPlane.isChunkBoundary(ns, boundary)) {
				return false;
			}
			try {
				controlPlane.splitAt(ns, boundary);
				return true;
			} catch (MongoException e) {
				// a concurrent or earlier attempt may have created the boundary after all
				if (controlPlane.isChunkBoundary(ns, boundary)) {
					logger.debug("split at {} failed but boundary exists: {}", boundary.toJson(), e.getMessage());
					return false;
				}
				throw e;
			}
		}, attempt -> record.addAttempts(1));
	}

	private boolean move(KeyRange range, String targetShard) throws RetriesExhaustedException {
		return retryPolicy.call("moveRange " + range + " to " + targetShard, () -> {
			Set<String> owners = controlPlane.getOwningShards(ns, range);
			if (owners.equals(Collections.singleton(targetShard))) {
				return false;
			}
			controlPlane.moveRange(ns, range, targetShard);
			return true;
		}, attempt -> record.addAttempts(1));
	}
}
