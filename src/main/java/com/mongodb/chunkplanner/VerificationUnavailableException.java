package com.mongodb.chunkplanner;

public class VerificationUnavailableException extends ChunkPlannerException {

	private static final long serialVersionUID = 1L;

	public VerificationUnavailableException(String message, Throwable cause) {
		super("verify", message, cause);
	}
}
