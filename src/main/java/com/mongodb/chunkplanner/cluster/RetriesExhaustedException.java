package com.mongodb.chunkplanner.cluster;

/**
 * A cluster operation kept failing, or failed with an error that is not worth retrying.
 */
public class RetriesExhaustedException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int attempts;

	public RetriesExhaustedException(String operation, int attempts, Throwable cause) {
		super(String.format("%s failed after %d attempt(s): %s", operation, attempts, cause.getMessage()), cause);
		this.attempts = attempts;
	}

	public int getAttempts() {
		return attempts;
	}
}
