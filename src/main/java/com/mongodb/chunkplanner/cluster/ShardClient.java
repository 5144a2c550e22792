package com.mongodb.chunkplanner.cluster;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Filters.lt;
import static com.mongodb.client.model.Filters.ne;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.UuidRepresentation;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.chunkplanner.model.KeyRange;
import com.mongodb.chunkplanner.model.Namespace;
import com.mongodb.chunkplanner.model.Shard;
import com.mongodb.chunkplanner.model.ShardKeyPattern;
import com.mongodb.chunkplanner.util.MaskUtil;

/**
 * Cluster control plane and metrics source backed by a mongos connection.
 */
public class ShardClient implements ClusterControlPlane, MetricsSource, AutoCloseable {

	private static Logger logger = LoggerFactory.getLogger(ShardClient.class);

	private final String name;
	private final ConnectionString connectionString;
	private final long operationTimeoutMs;

	private MongoClient mongoClient;
	private MongoDatabase configDb;
	private String version;
	private List<Integer> versionArray;
	private boolean mongos;

	public ShardClient(String name, String clusterUri, long operationTimeoutMs) {
		this.name = name;
		this.connectionString = new ConnectionString(clusterUri);
		this.operationTimeoutMs = operationTimeoutMs;
		logger.info(String.format("%s client, uri: %s", name, MaskUtil.maskConnectionString(connectionString)));
	}

	public void init() {
		MongoClientSettings mongoClientSettings = MongoClientSettings.builder()
				.applyConnectionString(connectionString)
				.uuidRepresentation(UuidRepresentation.STANDARD)
				.applyToSocketSettings(builder -> builder.readTimeout((int) Math.min(Integer.MAX_VALUE, operationTimeoutMs),
						MILLISECONDS))
				.build();
		mongoClient = MongoClients.create(mongoClientSettings);
		configDb = mongoClient.getDatabase("config");

		try {
			Document dbgridResult = adminCommand(new Document("isdbgrid", 1));
			mongos = Integer.valueOf(1).equals(dbgridResult.getInteger("isdbgrid"));
		} catch (MongoException mce) {
			// not a mongos, isdbgrid is unsupported on mongod
			logger.debug("{}: isdbgrid not supported: {}", name, mce.getMessage());
		}
		if (!mongos) {
			throw new IllegalArgumentException(name + " connection must be to a mongos router of a sharded cluster");
		}
		initVersionArray();
	}

	@SuppressWarnings("unchecked")
	public void initVersionArray() {
		Document buildInfo = adminCommand(new Document("buildinfo", 1));
		version = buildInfo.getString("version");
		versionArray = (List<Integer>) buildInfo.get("versionArray");
		logger.info(String.format("%s : MongoDB version: %s, mongos: %s", name, version, mongos));
	}

	@Override
	public List<Shard> listShards() {
		List<Shard> shards = new ArrayList<>();
		for (Document sh : configDb.getCollection("shards").find().sort(Sorts.ascending("_id"))) {
			Shard shard = Shard.fromConfigHost(sh.getString("_id"), sh.getString("host"));
			logger.debug("{}: listShards shard: {}", name, shard);
			shards.add(shard);
		}
		return shards;
	}

	@Override
	public void splitAt(Namespace ns, BsonDocument boundary) {
		Document splitCommand = new Document("split", ns.getNamespace());
		splitCommand.put("middle", boundary);
		splitCommand.put("maxTimeMS", operationTimeoutMs);
		adminCommand(splitCommand);
		logger.debug("{}: split {} at {}", name, ns, boundary.toJson());
	}

	@Override
	public void moveRange(Namespace ns, KeyRange range, String targetShard) {
		Document command;
		if (isVersion6OrLater()) {
			command = new Document("moveRange", ns.getNamespace())
					.append("min", range.getLowerBound())
					.append("max", range.getUpperBound())
					.append("toShard", targetShard);
		} else {
			// moveChunk takes the whole chunk containing the key, the split at the lower
			// bound makes that chunk start where the range does
			command = new Document("moveChunk", ns.getNamespace())
					.append("find", range.getLowerBound())
					.append("to", targetShard);
		}
		command.append("maxTimeMS", operationTimeoutMs);
		adminCommand(command);
		logger.debug("{}: moved {} {} to {}", name, ns, range, targetShard);
	}

	@Override
	public void setBalancerState(boolean enabled) {
		if (isLegacyBalancer()) {
			Document balancerId = new Document("_id", "balancer");
			Document setStopped = new Document("$set", new Document("stopped", !enabled));
			UpdateOptions updateOptions = new UpdateOptions().upsert(true);
			configDb.getCollection("settings").updateOne(balancerId, setStopped, updateOptions);
		} else if (enabled) {
			adminCommand(new Document("balancerStart", 1).append("maxTimeMS", operationTimeoutMs));
		} else {
			adminCommand(new Document("balancerStop", 1).append("maxTimeMS", operationTimeoutMs));
		}
		logger.info("{}: balancer {}", name, enabled ? "started" : "stopped");
	}

	@Override
	public boolean getBalancerState() {
		if (isLegacyBalancer()) {
			return isBalancerEnabled(configDb.getCollection("settings").find(eq("_id", "balancer")).first());
		}
		Document status = adminCommand(new Document("balancerStatus", 1));
		return !"off".equals(status.getString("mode"));
	}

	@Override
	public boolean isBalancerRoundActive() {
		if (isLegacyBalancer()) {
			// balancer lock state 2 means a round holds the lock
			return isBalancerLockHeld(configDb.getCollection("locks").find(eq("_id", "balancer")).first());
		}
		Document status = adminCommand(new Document("balancerStatus", 1));
		return status.getBoolean("inBalancerRound", false);
	}

	private boolean isLegacyBalancer() {
		return isLegacyBalancerVersion(versionArray);
	}

	// balancerStatus, balancerStart and balancerStop arrived in 3.4
	static boolean isLegacyBalancerVersion(List<Integer> versionArray) {
		return versionArray.get(0) == 2 || (versionArray.get(0) == 3 && versionArray.get(1) <= 2);
	}

	static boolean isBalancerEnabled(Document balancerSettings) {
		return balancerSettings == null || !balancerSettings.getBoolean("stopped", false);
	}

	static boolean isBalancerLockHeld(Document balancerLock) {
		return balancerLock != null && toLong(balancerLock.get("state")) == 2L;
	}

	@Override
	public boolean isChunkBoundary(Namespace ns, BsonDocument key) {
		Bson query = and(chunkNamespaceFilter(ns), eq("min", key));
		return getChunksCollection().countDocuments(query) > 0;
	}

	@Override
	public Set<String> getOwningShards(Namespace ns, KeyRange range) {
		Bson query = and(chunkNamespaceFilter(ns), lt("min", range.getUpperBound()), gt("max", range.getLowerBound()));
		Set<String> shards = new HashSet<>();
		getChunksCollection().distinct("shard", query, String.class).into(shards);
		return shards;
	}

	@Override
	public Map<String, Long> perShardCount(Namespace ns) {
		Map<String, Long> counts = new LinkedHashMap<>();
		for (Document d : collStats(ns, new Document("count", new Document()))) {
			counts.merge(d.getString("shard"), toLong(d.get("count")), Long::sum);
		}
		return counts;
	}

	@Override
	public Map<String, Long> perShardBytes(Namespace ns) {
		Map<String, Long> sizes = new LinkedHashMap<>();
		for (Document d : collStats(ns, new Document("storageStats", new Document()))) {
			Document storageStats = d.get("storageStats", Document.class);
			long size = storageStats == null ? 0L : toLong(storageStats.get("size"));
			sizes.merge(d.getString("shard"), size, Long::sum);
		}
		return sizes;
	}

	private List<Document> collStats(Namespace ns, Document options) {
		List<Document> results = new ArrayList<>();
		getCollection(ns).aggregate(Arrays.asList(new Document("$collStats", options))).into(results);
		return results;
	}

	public boolean isSharded(Namespace ns) {
		return configDb.getCollection("collections")
				.countDocuments(and(eq("_id", ns.getNamespace()), ne("dropped", true))) > 0;
	}

	public Document enableSharding(String dbName) {
		return adminCommand(new Document("enableSharding", dbName));
	}

	public Document shardCollection(Namespace ns, ShardKeyPattern keyPattern) {
		Document shardCommand = new Document("shardCollection", ns.getNamespace());
		shardCommand.append("key", keyPattern.toKeySpec());
		logger.info("{}: shardCollection {} key: {}", name, ns, keyPattern);
		return adminCommand(shardCommand);
	}

	/**
	 * Chunks reference their collection by uuid from 5.0 on, by ns before that.
	 */
	private Bson chunkNamespaceFilter(Namespace ns) {
		if (isVersion5OrLater()) {
			return eq("uuid", getUuidForNamespace(ns));
		}
		return eq("ns", ns.getNamespace());
	}

	public BsonBinary getUuidForNamespace(Namespace ns) {
		BsonDocument coll = configDb.getCollection("collections", BsonDocument.class)
				.find(eq("_id", ns.getNamespace())).first();
		if (coll == null || !coll.containsKey("uuid")) {
			throw new IllegalArgumentException(name + ": " + ns + " is not a sharded collection");
		}
		return coll.getBinary("uuid");
	}

	public Document runCommand(Document command, String dbName) {
		return mongoClient.getDatabase(dbName).runCommand(command);
	}

	public Document adminCommand(Document command) {
		return runCommand(command, "admin");
	}

	public MongoCollection<Document> getChunksCollection() {
		return configDb.getCollection("chunks");
	}

	public MongoCollection<Document> getCollection(Namespace ns) {
		return mongoClient.getDatabase(ns.getDatabaseName()).getCollection(ns.getCollectionName());
	}

	public String getVersion() {
		return version;
	}

	public boolean isVersion5OrLater() {
		return versionArray.get(0) >= 5;
	}

	public boolean isVersion6OrLater() {
		return versionArray.get(0) >= 6;
	}

	public String getName() {
		return name;
	}

	public ConnectionString getConnectionString() {
		return connectionString;
	}

	private static long toLong(Object value) {
		if (value instanceof Number) {
			return ((Number) value).longValue();
		}
		return 0L;
	}

	@Override
	public void close() {
		if (mongoClient != null) {
			mongoClient.close();
		}
	}

	@Override
	public String toString() {
		return name + " " + MaskUtil.maskConnectionString(connectionString);
	}
}
