package com.mongodb.chunkplanner.cluster;

import java.util.List;
import java.util.Set;

import org.bson.BsonDocument;

import com.mongodb.chunkplanner.model.KeyRange;
import com.mongodb.chunkplanner.model.Namespace;
import com.mongodb.chunkplanner.model.Shard;

/**
 * The sharded cluster's own metadata operations. All mutation of chunk placement and of
 * the balancer goes through here; the cluster serializes conflicting metadata changes.
 * Implementations throw the driver's {@link com.mongodb.MongoException} subtypes so that
 * callers can tell transient failures from permanent ones.
 */
public interface ClusterControlPlane {

	List<Shard> listShards();

	void splitAt(Namespace ns, BsonDocument boundary);

	void moveRange(Namespace ns, KeyRange range, String targetShard);

	void setBalancerState(boolean enabled);

	boolean getBalancerState();

	/**
	 * @return true while the balancer is in the middle of a balancing round
	 */
	boolean isBalancerRoundActive();

	/**
	 * @return true if a chunk of the collection starts exactly at the given key
	 */
	boolean isChunkBoundary(Namespace ns, BsonDocument key);

	/**
	 * @return ids of the shards owning any chunk that overlaps the range
	 */
	Set<String> getOwningShards(Namespace ns, KeyRange range);
}
