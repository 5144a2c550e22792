package com.mongodb.chunkplanner;

/**
 * The key domain cannot be split as requested. Never retried.
 */
public class InvalidDomainException extends ChunkPlannerException {

	private static final long serialVersionUID = 1L;

	public InvalidDomainException(String message) {
		super("split", message);
	}
}
