package com.mongodb.chunkplanner;

/**
 * The automatic balancer could not be stopped or started. Fatal to a run: manual
 * placement must not proceed while automatic migrations may be running.
 */
public class BalancerStateException extends ChunkPlannerException {

	private static final long serialVersionUID = 1L;

	public BalancerStateException(String operation, String message) {
		super(operation, message);
	}

	public BalancerStateException(String operation, String message, Throwable cause) {
		super(operation, message, cause);
	}
}
