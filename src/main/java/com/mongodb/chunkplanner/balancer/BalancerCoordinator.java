package com.mongodb.chunkplanner.balancer;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.chunkplanner.BalancerStateException;
import com.mongodb.chunkplanner.cluster.ClusterControlPlane;
import com.mongodb.chunkplanner.cluster.RetriesExhaustedException;
import com.mongodb.chunkplanner.cluster.RetryPolicy;

/**
 * Stops the automatic balancer around manual placement and starts it again afterwards.
 * <p>
 * Both directions are idempotent: suspending a stopped balancer and resuming a running
 * one are no-ops, so a crashed run can simply be repeated. Resume never stops the
 * balancer.
 */
public class BalancerCoordinator {

	private static Logger logger = LoggerFactory.getLogger(BalancerCoordinator.class);

	public final static long DEFAULT_POLL_INTERVAL_MS = 1000;

	private final ClusterControlPlane controlPlane;
	private final RetryPolicy retryPolicy;
	private final long drainTimeoutMs;
	private final long pollIntervalMs;
	private final RetryPolicy.Sleeper sleeper;

	public BalancerCoordinator(ClusterControlPlane controlPlane, RetryPolicy retryPolicy, long drainTimeoutMs) {
		this(controlPlane, retryPolicy, drainTimeoutMs, DEFAULT_POLL_INTERVAL_MS, Thread::sleep);
	}

	public BalancerCoordinator(ClusterControlPlane controlPlane, RetryPolicy retryPolicy, long drainTimeoutMs,
			long pollIntervalMs, RetryPolicy.Sleeper sleeper) {
		this.controlPlane = controlPlane;
		this.retryPolicy = retryPolicy;
		this.drainTimeoutMs = drainTimeoutMs;
		this.pollIntervalMs = pollIntervalMs;
		this.sleeper = sleeper;
	}

	/**
	 * Stops the balancer and waits for any active round to finish. When this call stopped
	 * the balancer and the wait fails, the balancer is started again before the failure
	 * propagates.
	 */
	public void suspend() {
		boolean enabled = retry("suspend", controlPlane::getBalancerState);
		if (enabled) {
			retry("suspend", () -> {
				controlPlane.setBalancerState(false);
				return null;
			});
			logger.info("balancer stopped");
		} else {
			logger.info("balancer already stopped");
		}
		try {
			awaitBalancerRoundComplete();
		} catch (RuntimeException e) {
			if (enabled) {
				logger.warn("suspend failed, starting balancer again: {}", e.getMessage());
				try {
					resume();
				} catch (RuntimeException resumeError) {
					e.addSuppressed(resumeError);
				}
			}
			throw e;
		}
	}

	public void resume() {
		boolean enabled = retry("resume", controlPlane::getBalancerState);
		if (enabled) {
			logger.info("balancer already running");
			return;
		}
		retry("resume", () -> {
			controlPlane.setBalancerState(true);
			return null;
		});
		logger.info("balancer started");
	}

	public boolean isBalancerEnabled() {
		return retry("balancerStatus", controlPlane::getBalancerState);
	}

	/**
	 * Suspends the balancer and returns a handle that resumes it when closed, meant for
	 * try-with-resources.
	 */
	public BalancerSuspension suspendScoped() {
		suspend();
		return new BalancerSuspension(this);
	}

	/**
	 * Runs the work with the balancer stopped. The balancer is resumed on every exit path;
	 * when both the work and the resume fail, the resume failure is added as suppressed.
	 */
	public <T> T callWithBalancerSuspended(Callable<T> work) throws Exception {
		try (BalancerSuspension suspension = suspendScoped()) {
			return work.call();
		}
	}

	private void awaitBalancerRoundComplete() {
		long deadline = System.currentTimeMillis() + drainTimeoutMs;
		while (retry("suspend", controlPlane::isBalancerRoundActive)) {
			if (System.currentTimeMillis() >= deadline) {
				throw new BalancerStateException("suspend",
						String.format("balancer round still active after %d ms", drainTimeoutMs));
			}
			logger.debug("waiting for balancer round to complete");
			try {
				sleeper.sleep(pollIntervalMs);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new BalancerStateException("suspend", "interrupted waiting for balancer round to complete", e);
			}
		}
	}

	private <T> T retry(String operation, Callable<T> action) {
		try {
			return retryPolicy.call(operation, action);
		} catch (RetriesExhaustedException e) {
			throw new BalancerStateException(operation, e.getMessage(), e.getCause());
		}
	}
}
