package com.mongodb.chunkplanner.model;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * A shard as registered in <code>config.shards</code>.
 */
public class Shard {

	private final String id;
	private final String endpoint;
	private final String replicaSetName;

	public Shard(String id, String endpoint, String replicaSetName) {
		if (StringUtils.isBlank(id)) {
			throw new IllegalArgumentException("shard id must not be blank");
		}
		this.id = id;
		this.endpoint = endpoint;
		this.replicaSetName = replicaSetName;
	}

	/**
	 * Parses the <code>host</code> field of a config.shards document, for example
	 * <code>shard1RS/shard1a:27018,shard1b:27018</code>. A host without a replica set
	 * prefix is a standalone, its replica set name is left null.
	 */
	public static Shard fromConfigHost(String id, String host) {
		if (host != null && host.contains("/")) {
			return new Shard(id, StringUtils.substringAfter(host, "/"), StringUtils.substringBefore(host, "/"));
		}
		return new Shard(id, host, null);
	}

	public String getId() {
		return id;
	}

	public String getEndpoint() {
		return endpoint;
	}

	public String getReplicaSetName() {
		return replicaSetName;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, endpoint, replicaSetName);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Shard))
			return false;
		Shard other = (Shard) obj;
		return id.equals(other.id) && Objects.equals(endpoint, other.endpoint)
				&& Objects.equals(replicaSetName, other.replicaSetName);
	}

	@Override
	public String toString() {
		return replicaSetName == null ? String.format("%s(%s)", id, endpoint)
				: String.format("%s(%s/%s)", id, replicaSetName, endpoint);
	}
}
