package com.mongodb.chunkplanner.balancer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a suspended balancer. Closing it resumes the balancer, at most once no
 * matter how many times close is called.
 */
public class BalancerSuspension implements AutoCloseable {

	private final BalancerCoordinator coordinator;
	private final AtomicBoolean closed = new AtomicBoolean();
	private volatile boolean keepStopped;

	BalancerSuspension(BalancerCoordinator coordinator) {
		this.coordinator = coordinator;
	}

	/**
	 * Leave the balancer stopped on close, for an external bulk load that runs after
	 * this process is done. The balancer has to be started again explicitly.
	 */
	public void keepStopped() {
		this.keepStopped = true;
	}

	public boolean isClosed() {
		return closed.get();
	}

	@Override
	public void close() {
		if (closed.compareAndSet(false, true) && !keepStopped) {
			coordinator.resume();
		}
	}
}
