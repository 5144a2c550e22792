package com.mongodb.chunkplanner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.util.Map;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;

import com.mongodb.chunkplanner.model.DistributionMetric;
import com.mongodb.chunkplanner.split.IntegerKeyDomain;
import com.mongodb.chunkplanner.split.KeyDomain;
import com.mongodb.chunkplanner.split.StringKeyDomain;

public class ChunkPlannerConfigTest {

	@Test
	public void testDefaults() {
		ChunkPlannerConfig config = new ChunkPlannerConfig();
		config.validate();
		assertNull(config.getSource());
		assertEquals("marketplace.products", config.getNamespace());
		assertEquals(99, config.getSplitCount());
		assertEquals(0.05, config.getTolerance(), 0.0);
		assertEquals(1, config.getConcurrency());
		KeyDomain domain = config.toKeyDomain();
		assertTrue(domain instanceof IntegerKeyDomain);
		assertEquals(100, domain.size());
	}

	@Test
	public void testLoadProperties() throws Exception {
		File file = new File(getClass().getResource("/chunk-planner-test.properties").toURI());
		ChunkPlannerConfig config = ChunkPlannerConfig.load(file);
		config.validate();

		assertEquals("shop.items", config.toNamespace().getNamespace());
		assertEquals("region", config.toKeyPattern().getPrimaryField());
		assertEquals(2, config.getShardCount());
		assertEquals(4, config.getConcurrency());
		assertEquals(7, config.getMaxAttempts());
		assertEquals(500, config.getInitialBackoffMs());
		assertEquals(DistributionMetric.BYTES, config.getDistributionMetric());
		assertEquals(3, config.getShardWeights().get("shard0").intValue());
		assertTrue(config.toKeyDomain() instanceof StringKeyDomain);
		assertEquals(4, config.toKeyDomain().size());
	}

	@Test
	public void testParseShardWeights() {
		Map<String, Integer> weights = ChunkPlannerConfig.parseShardWeights("a:2", " b : 1 ", "");
		assertEquals(2, weights.size());
		assertEquals(1, weights.get("b").intValue());
		assertThrows(IllegalArgumentException.class, () -> ChunkPlannerConfig.parseShardWeights("a"));
		assertThrows(IllegalArgumentException.class, () -> ChunkPlannerConfig.parseShardWeights("a:x"));
	}

	@Test
	public void testValidation() {
		assertInvalid(c -> c.setTolerance(1.5));
		assertInvalid(c -> c.setTolerance(-0.1));
		assertInvalid(c -> c.setConcurrency(0));
		assertInvalid(c -> c.setSplitCount(0));
		assertInvalid(c -> c.setShardCount(-1));
		assertInvalid(c -> c.setNamespace("nodot"));
		assertInvalid(c -> c.setTiebreakerKeyField("category_id"));
		assertInvalid(c -> c.setDomainMax(0));
		assertInvalid(c -> c.setAssignmentPolicy("random"));
		assertInvalid(c -> c.setMaxBackoffMs(10));
		assertInvalid(c -> c.setMaxAttempts(0));
	}

	private static void assertInvalid(Consumer<ChunkPlannerConfig> change) {
		ChunkPlannerConfig config = new ChunkPlannerConfig();
		change.accept(config);
		assertThrows(IllegalArgumentException.class, config::validate);
	}
}
