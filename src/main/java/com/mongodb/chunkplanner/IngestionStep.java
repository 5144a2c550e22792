package com.mongodb.chunkplanner;

import com.mongodb.chunkplanner.model.PlacementPlan;

/**
 * Bulk load run after the plan is applied while the balancer is still stopped, so that
 * incoming documents land on their pre-placed chunks.
 */
@FunctionalInterface
public interface IngestionStep {

	void ingest(PlacementPlan plan) throws Exception;
}
