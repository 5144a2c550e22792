package com.mongodb.chunkplanner.cluster;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with exponential backoff for single cluster operations. The delay before
 * attempt n+1 is <code>initialBackoffMs * 2^(n-1)</code>, capped at maxBackoffMs.
 */
public class RetryPolicy {

	private static Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	public interface Sleeper {
		void sleep(long millis) throws InterruptedException;
	}

	private final int maxAttempts;
	private final long initialBackoffMs;
	private final long maxBackoffMs;
	private final Predicate<Throwable> retryable;
	private final Sleeper sleeper;

	public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
		this(maxAttempts, initialBackoffMs, maxBackoffMs, TransientErrors::isTransient, Thread::sleep);
	}

	public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs, Predicate<Throwable> retryable,
			Sleeper sleeper) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
		}
		this.maxAttempts = maxAttempts;
		this.initialBackoffMs = initialBackoffMs;
		this.maxBackoffMs = maxBackoffMs;
		this.retryable = retryable;
		this.sleeper = sleeper;
	}

	public RetryPolicy withSleeper(Sleeper sleeper) {
		return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs, retryable, sleeper);
	}

	public long backoffMillis(int attempt) {
		double delay = initialBackoffMs * Math.pow(2, attempt - 1);
		return (long) Math.min(delay, maxBackoffMs);
	}

	public <T> T call(String operation, Callable<T> action) throws RetriesExhaustedException {
		return call(operation, action, null);
	}

	/**
	 * @param attemptListener notified with the attempt number before each attempt, may be null
	 */
	public <T> T call(String operation, Callable<T> action, AttemptListener attemptListener)
			throws RetriesExhaustedException {
		int attempt = 0;
		while (true) {
			attempt++;
			if (attemptListener != null) {
				attemptListener.onAttempt(attempt);
			}
			try {
				return action.call();
			} catch (Exception e) {
				if (!retryable.test(e)) {
					logger.debug("{}: non transient error, not retrying: {}", operation, e.getMessage());
					throw new RetriesExhaustedException(operation, attempt, e);
				}
				if (attempt >= maxAttempts) {
					logger.error("{}: attempt {}/{} failed, no more retries: {}", operation, attempt, maxAttempts,
							e.getMessage());
					throw new RetriesExhaustedException(operation, attempt, e);
				}
				long delay = backoffMillis(attempt);
				logger.warn("{}: attempt {}/{} failed, retrying in {} ms: {}", operation, attempt, maxAttempts, delay,
						e.getMessage());
				try {
					sleeper.sleep(delay);
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					throw new RetriesExhaustedException(operation, attempt, e);
				}
			}
		}
	}

	public interface AttemptListener {
		void onAttempt(int attempt);
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public long getInitialBackoffMs() {
		return initialBackoffMs;
	}

	public long getMaxBackoffMs() {
		return maxBackoffMs;
	}
}
