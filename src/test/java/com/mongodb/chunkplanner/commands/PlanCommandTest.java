package com.mongodb.chunkplanner.commands;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

import com.mongodb.chunkplanner.ChunkPlannerConfig;

public class PlanCommandTest {

	@Test
	public void testIntegerRouteValue() {
		ChunkPlannerConfig config = new ChunkPlannerConfig();
		assertEquals(new BsonInt32(42), PlanCommand.toPrimaryValue(config, "42"));
		assertEquals(new BsonInt64(1L << 40), PlanCommand.toPrimaryValue(config, String.valueOf(1L << 40)));
		assertThrows(IllegalArgumentException.class, () -> PlanCommand.toPrimaryValue(config, "books"));
	}

	@Test
	public void testStringRouteValue() {
		ChunkPlannerConfig config = new ChunkPlannerConfig();
		config.setDomainValues(new String[] { "books", "garden" });
		assertEquals(new BsonString("books"), PlanCommand.toPrimaryValue(config, "books"));
	}
}
