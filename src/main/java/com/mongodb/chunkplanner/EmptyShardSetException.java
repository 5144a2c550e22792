package com.mongodb.chunkplanner;

public class EmptyShardSetException extends ChunkPlannerException {

	private static final long serialVersionUID = 1L;

	public EmptyShardSetException(String operation, String message) {
		super(operation, message);
	}
}
