package com.mongodb.chunkplanner.cluster;

import java.util.Map;

import com.mongodb.chunkplanner.model.Namespace;

public interface MetricsSource {

	Map<String, Long> perShardCount(Namespace ns);

	Map<String, Long> perShardBytes(Namespace ns);
}
