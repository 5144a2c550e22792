package com.mongodb.chunkplanner;

/**
 * Base class for the planner's failures. Each carries the operation that was being
 * attempted when it was raised.
 */
public class ChunkPlannerException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String operation;

	public ChunkPlannerException(String operation, String message) {
		super(message);
		this.operation = operation;
	}

	public ChunkPlannerException(String operation, String message, Throwable cause) {
		super(message, cause);
		this.operation = operation;
	}

	public String getOperation() {
		return operation;
	}

	@Override
	public String getMessage() {
		return String.format("%s: %s", operation, super.getMessage());
	}
}
