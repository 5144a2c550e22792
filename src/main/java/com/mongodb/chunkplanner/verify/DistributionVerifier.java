package com.mongodb.chunkplanner.verify;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.chunkplanner.VerificationUnavailableException;
import com.mongodb.chunkplanner.cluster.MetricsSource;
import com.mongodb.chunkplanner.model.DistributionMetric;
import com.mongodb.chunkplanner.model.DistributionReport;
import com.mongodb.chunkplanner.model.Namespace;

/**
 * Reads per-shard document counts (or data sizes) and turns them into a
 * {@link DistributionReport}. One read, no waiting; polling until the cluster settles is
 * up to the caller.
 */
public class DistributionVerifier {

	private static Logger logger = LoggerFactory.getLogger(DistributionVerifier.class);

	private final MetricsSource metricsSource;
	private final DistributionMetric metric;

	public DistributionVerifier(MetricsSource metricsSource) {
		this(metricsSource, DistributionMetric.COUNT);
	}

	public DistributionVerifier(MetricsSource metricsSource, DistributionMetric metric) {
		this.metricsSource = metricsSource;
		this.metric = metric;
	}

	/**
	 * @param expectedShards shards that should hold data, reported with 0 when the metrics
	 *                       have nothing for them; may be empty
	 */
	public DistributionReport verify(Namespace ns, Collection<String> expectedShards) {
		Map<String, Long> measured;
		try {
			measured = metric == DistributionMetric.BYTES ? metricsSource.perShardBytes(ns)
					: metricsSource.perShardCount(ns);
		} catch (RuntimeException e) {
			throw new VerificationUnavailableException(
					String.format("unable to read per-shard %s for %s", metric.getUnit(), ns), e);
		}

		Map<String, Long> counts = new LinkedHashMap<>();
		for (String shardId : expectedShards) {
			counts.put(shardId, 0L);
		}
		measured.forEach((shardId, value) -> counts.merge(shardId, value, Long::sum));

		DistributionReport report = new DistributionReport(ns, metric, counts);
		logger.debug("{}", report);
		return report;
	}

	public DistributionMetric getMetric() {
		return metric;
	}
}
