package com.mongodb.chunkplanner.executor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Makes the dispatching thread wait for queue space instead of rejecting, so entries are
 * handed to workers only as fast as they are consumed.
 */
class BlockWhenQueueFull implements RejectedExecutionHandler {

	@Override
	public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
		if (executor.isShutdown()) {
			throw new RejectedExecutionException("placement executor has been shut down");
		}
		try {
			executor.getQueue().put(r);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RejectedExecutionException("interrupted while dispatching", e);
		}
	}
}
