package com.mongodb.chunkplanner;

import java.io.File;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.convert.DefaultListDelimiterHandler;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

import com.mongodb.chunkplanner.assign.RoundRobinChunkAssigner;
import com.mongodb.chunkplanner.assign.WeightedChunkAssigner;
import com.mongodb.chunkplanner.cluster.RetryPolicy;
import com.mongodb.chunkplanner.model.DistributionMetric;
import com.mongodb.chunkplanner.model.Namespace;
import com.mongodb.chunkplanner.model.ShardKeyPattern;
import com.mongodb.chunkplanner.split.IntegerKeyDomain;
import com.mongodb.chunkplanner.split.KeyDomain;
import com.mongodb.chunkplanner.split.StringKeyDomain;

public class ChunkPlannerConfig {

	public final static String SOURCE = "source";
	public final static String NAMESPACE = "namespace";
	public final static String PRIMARY_KEY_FIELD = "primaryKeyField";
	public final static String TIEBREAKER_KEY_FIELD = "tiebreakerKeyField";
	public final static String DOMAIN_MIN = "domainMin";
	public final static String DOMAIN_MAX = "domainMax";
	public final static String DOMAIN_VALUES = "domainValues";
	public final static String SHARD_COUNT = "shardCount";
	public final static String SPLIT_COUNT = "splitCount";
	public final static String TOLERANCE = "tolerance";
	public final static String CONCURRENCY = "concurrency";
	public final static String ASSIGNMENT_POLICY = "assignmentPolicy";
	public final static String SHARD_WEIGHTS = "shardWeights";
	public final static String MAX_ATTEMPTS = "maxAttempts";
	public final static String INITIAL_BACKOFF_MS = "initialBackoffMs";
	public final static String MAX_BACKOFF_MS = "maxBackoffMs";
	public final static String OPERATION_TIMEOUT_MS = "operationTimeoutMs";
	public final static String BALANCER_DRAIN_TIMEOUT_MS = "balancerDrainTimeoutMs";
	public final static String DISTRIBUTION_METRIC = "distributionMetric";

	private String source;
	private String namespace = "marketplace.products";
	private String primaryKeyField = "category_id";
	private String tiebreakerKeyField = "product_id";
	private long domainMin = 0;
	private long domainMax = 100;
	private String[] domainValues = new String[0];
	private int shardCount = 0;
	private int splitCount = 99;
	private double tolerance = 0.05;
	private int concurrency = 1;
	private String assignmentPolicy = RoundRobinChunkAssigner.NAME;
	private Map<String, Integer> shardWeights = new LinkedHashMap<>();
	private int maxAttempts = 5;
	private long initialBackoffMs = 500;
	private long maxBackoffMs = 30000;
	private long operationTimeoutMs = 600000;
	private long balancerDrainTimeoutMs = 300000;
	private DistributionMetric distributionMetric = DistributionMetric.COUNT;

	/**
	 * Reads a properties file; keys not present keep their defaults.
	 */
	public static ChunkPlannerConfig load(File configFile) throws ConfigurationException {
		FileBasedConfigurationBuilder<PropertiesConfiguration> builder = new FileBasedConfigurationBuilder<>(
				PropertiesConfiguration.class)
				.configure(new Parameters().properties().setFile(configFile).setThrowExceptionOnMissing(true)
						.setListDelimiterHandler(new DefaultListDelimiterHandler(',')).setIncludesAllowed(false));
		return fromConfiguration(builder.getConfiguration());
	}

	public static ChunkPlannerConfig fromConfiguration(Configuration config) {
		ChunkPlannerConfig c = new ChunkPlannerConfig();
		c.source = config.getString(SOURCE, c.source);
		c.namespace = config.getString(NAMESPACE, c.namespace);
		c.primaryKeyField = config.getString(PRIMARY_KEY_FIELD, c.primaryKeyField);
		c.tiebreakerKeyField = config.getString(TIEBREAKER_KEY_FIELD, c.tiebreakerKeyField);
		c.domainMin = config.getLong(DOMAIN_MIN, c.domainMin);
		c.domainMax = config.getLong(DOMAIN_MAX, c.domainMax);
		if (config.containsKey(DOMAIN_VALUES)) {
			c.domainValues = config.getStringArray(DOMAIN_VALUES);
		}
		c.shardCount = config.getInt(SHARD_COUNT, c.shardCount);
		c.splitCount = config.getInt(SPLIT_COUNT, c.splitCount);
		c.tolerance = config.getDouble(TOLERANCE, c.tolerance);
		c.concurrency = config.getInt(CONCURRENCY, c.concurrency);
		c.assignmentPolicy = config.getString(ASSIGNMENT_POLICY, c.assignmentPolicy);
		if (config.containsKey(SHARD_WEIGHTS)) {
			c.shardWeights = parseShardWeights(config.getStringArray(SHARD_WEIGHTS));
		}
		c.maxAttempts = config.getInt(MAX_ATTEMPTS, c.maxAttempts);
		c.initialBackoffMs = config.getLong(INITIAL_BACKOFF_MS, c.initialBackoffMs);
		c.maxBackoffMs = config.getLong(MAX_BACKOFF_MS, c.maxBackoffMs);
		c.operationTimeoutMs = config.getLong(OPERATION_TIMEOUT_MS, c.operationTimeoutMs);
		c.balancerDrainTimeoutMs = config.getLong(BALANCER_DRAIN_TIMEOUT_MS, c.balancerDrainTimeoutMs);
		if (config.containsKey(DISTRIBUTION_METRIC)) {
			c.distributionMetric = DistributionMetric.fromString(config.getString(DISTRIBUTION_METRIC));
		}
		return c;
	}

	/**
	 * Parses <code>shardId:weight</code> pairs.
	 */
	public static Map<String, Integer> parseShardWeights(String... pairs) {
		Map<String, Integer> weights = new LinkedHashMap<>();
		if (pairs == null) {
			return weights;
		}
		for (String pair : pairs) {
			if (StringUtils.isBlank(pair)) {
				continue;
			}
			String shardId = StringUtils.trim(StringUtils.substringBeforeLast(pair, ":"));
			String weight = StringUtils.trim(StringUtils.substringAfterLast(pair, ":"));
			if (StringUtils.isEmpty(shardId) || !StringUtils.isNumeric(weight)) {
				throw new IllegalArgumentException(
						String.format("%s: expected shardId:weight, got '%s'", SHARD_WEIGHTS, pair));
			}
			weights.put(shardId, Integer.valueOf(weight));
		}
		return weights;
	}

	public void validate() {
		require(StringUtils.isNotBlank(namespace), NAMESPACE, "must not be empty");
		try {
			new Namespace(namespace);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(NAMESPACE + ": " + e.getMessage(), e);
		}
		require(StringUtils.isNotBlank(primaryKeyField), PRIMARY_KEY_FIELD, "must not be empty");
		require(StringUtils.isNotBlank(tiebreakerKeyField), TIEBREAKER_KEY_FIELD, "must not be empty");
		require(!primaryKeyField.equals(tiebreakerKeyField), TIEBREAKER_KEY_FIELD,
				"must differ from " + PRIMARY_KEY_FIELD);
		if (!isStringDomain()) {
			require(domainMin < domainMax, DOMAIN_MAX, "must be greater than " + DOMAIN_MIN);
		}
		require(shardCount >= 0, SHARD_COUNT, "must be >= 0");
		require(splitCount >= 1, SPLIT_COUNT, "must be >= 1");
		require(tolerance >= 0.0 && tolerance <= 1.0, TOLERANCE, "must be in [0, 1]");
		require(concurrency >= 1, CONCURRENCY, "must be >= 1");
		require(RoundRobinChunkAssigner.NAME.equalsIgnoreCase(assignmentPolicy)
				|| WeightedChunkAssigner.NAME.equalsIgnoreCase(assignmentPolicy), ASSIGNMENT_POLICY,
				"must be " + RoundRobinChunkAssigner.NAME + " or " + WeightedChunkAssigner.NAME);
		for (Map.Entry<String, Integer> e : shardWeights.entrySet()) {
			require(e.getValue() >= 1, SHARD_WEIGHTS, "weight for " + e.getKey() + " must be >= 1");
		}
		require(maxAttempts >= 1, MAX_ATTEMPTS, "must be >= 1");
		require(initialBackoffMs >= 0, INITIAL_BACKOFF_MS, "must be >= 0");
		require(maxBackoffMs >= initialBackoffMs, MAX_BACKOFF_MS, "must be >= " + INITIAL_BACKOFF_MS);
		require(operationTimeoutMs > 0, OPERATION_TIMEOUT_MS, "must be > 0");
		require(balancerDrainTimeoutMs >= 0, BALANCER_DRAIN_TIMEOUT_MS, "must be >= 0");
		require(distributionMetric != null, DISTRIBUTION_METRIC, "must be count or bytes");
	}

	private static void require(boolean condition, String key, String message) {
		if (!condition) {
			throw new IllegalArgumentException(key + " " + message);
		}
	}

	public boolean isStringDomain() {
		return domainValues != null && domainValues.length > 0;
	}

	public KeyDomain toKeyDomain() {
		if (isStringDomain()) {
			return new StringKeyDomain(Arrays.asList(domainValues));
		}
		return new IntegerKeyDomain(domainMin, domainMax);
	}

	public ShardKeyPattern toKeyPattern() {
		return new ShardKeyPattern(primaryKeyField, tiebreakerKeyField);
	}

	public Namespace toNamespace() {
		return new Namespace(namespace);
	}

	public RetryPolicy toRetryPolicy() {
		return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs);
	}

	public String getSource() {
		return source;
	}

	public void setSource(String source) {
		this.source = source;
	}

	public String getNamespace() {
		return namespace;
	}

	public void setNamespace(String namespace) {
		this.namespace = namespace;
	}

	public String getPrimaryKeyField() {
		return primaryKeyField;
	}

	public void setPrimaryKeyField(String primaryKeyField) {
		this.primaryKeyField = primaryKeyField;
	}

	public String getTiebreakerKeyField() {
		return tiebreakerKeyField;
	}

	public void setTiebreakerKeyField(String tiebreakerKeyField) {
		this.tiebreakerKeyField = tiebreakerKeyField;
	}

	public long getDomainMin() {
		return domainMin;
	}

	public void setDomainMin(long domainMin) {
		this.domainMin = domainMin;
	}

	public long getDomainMax() {
		return domainMax;
	}

	public void setDomainMax(long domainMax) {
		this.domainMax = domainMax;
	}

	public String[] getDomainValues() {
		return domainValues;
	}

	public void setDomainValues(String[] domainValues) {
		this.domainValues = domainValues;
	}

	public int getShardCount() {
		return shardCount;
	}

	public void setShardCount(int shardCount) {
		this.shardCount = shardCount;
	}

	public int getSplitCount() {
		return splitCount;
	}

	public void setSplitCount(int splitCount) {
		this.splitCount = splitCount;
	}

	public double getTolerance() {
		return tolerance;
	}

	public void setTolerance(double tolerance) {
		this.tolerance = tolerance;
	}

	public int getConcurrency() {
		return concurrency;
	}

	public void setConcurrency(int concurrency) {
		this.concurrency = concurrency;
	}

	public String getAssignmentPolicy() {
		return assignmentPolicy;
	}

	public void setAssignmentPolicy(String assignmentPolicy) {
		this.assignmentPolicy = assignmentPolicy;
	}

	public Map<String, Integer> getShardWeights() {
		return shardWeights;
	}

	public void setShardWeights(Map<String, Integer> shardWeights) {
		this.shardWeights = shardWeights;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public void setMaxAttempts(int maxAttempts) {
		this.maxAttempts = maxAttempts;
	}

	public long getInitialBackoffMs() {
		return initialBackoffMs;
	}

	public void setInitialBackoffMs(long initialBackoffMs) {
		this.initialBackoffMs = initialBackoffMs;
	}

	public long getMaxBackoffMs() {
		return maxBackoffMs;
	}

	public void setMaxBackoffMs(long maxBackoffMs) {
		this.maxBackoffMs = maxBackoffMs;
	}

	public long getOperationTimeoutMs() {
		return operationTimeoutMs;
	}

	public void setOperationTimeoutMs(long operationTimeoutMs) {
		this.operationTimeoutMs = operationTimeoutMs;
	}

	public long getBalancerDrainTimeoutMs() {
		return balancerDrainTimeoutMs;
	}

	public void setBalancerDrainTimeoutMs(long balancerDrainTimeoutMs) {
		this.balancerDrainTimeoutMs = balancerDrainTimeoutMs;
	}

	public DistributionMetric getDistributionMetric() {
		return distributionMetric;
	}

	public void setDistributionMetric(DistributionMetric distributionMetric) {
		this.distributionMetric = distributionMetric;
	}
}
