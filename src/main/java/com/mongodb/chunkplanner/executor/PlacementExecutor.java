package com.mongodb.chunkplanner.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mongodb.chunkplanner.cluster.ClusterControlPlane;
import com.mongodb.chunkplanner.cluster.RetryPolicy;
import com.mongodb.chunkplanner.model.ExecutionRecord;
import com.mongodb.chunkplanner.model.PlacementEntry;
import com.mongodb.chunkplanner.model.PlacementPlan;

/**
 * Applies a placement plan to the cluster with a fixed pool of workers. Failed entries are
 * recorded and the rest of the plan continues. With a single worker, entries are applied
 * in plan order.
 * <p>
 * Once {@link #cancel()} has been called the executor dispatches nothing more; entries
 * already running are allowed to finish.
 */
public class PlacementExecutor {

	private static Logger logger = LoggerFactory.getLogger(PlacementExecutor.class);

	private final static long PROGRESS_LOG_INTERVAL_SECONDS = 60;

	private final ClusterControlPlane controlPlane;
	private final RetryPolicy retryPolicy;
	private final int concurrency;

	private final AtomicBoolean cancelled = new AtomicBoolean();

	public PlacementExecutor(ClusterControlPlane controlPlane, RetryPolicy retryPolicy, int concurrency) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("concurrency must be >= 1, was " + concurrency);
		}
		this.controlPlane = controlPlane;
		this.retryPolicy = retryPolicy;
		this.concurrency = concurrency;
	}

	public ExecutionResult execute(PlacementPlan plan) {
		List<ExecutionRecord> records = new ArrayList<>(plan.size());
		for (PlacementEntry entry : plan.getEntries()) {
			records.add(new ExecutionRecord(entry));
		}
		logger.info("applying {} entries to {} with {} worker(s)", records.size(), plan.getNamespace(), concurrency);

		ThreadPoolExecutor pool = new ThreadPoolExecutor(concurrency, concurrency, 30, TimeUnit.SECONDS,
				new ArrayBlockingQueue<>(concurrency), new BlockWhenQueueFull());
		pool.setThreadFactory(new ThreadFactoryBuilder().setNameFormat("PlacementWorker-%d").build());

		AtomicInteger processed = new AtomicInteger();
		ProgressLogger progress = new ProgressLogger(records.size());
		try {
			for (ExecutionRecord record : records) {
				if (cancelled.get()) {
					break;
				}
				PlacementTask task = new PlacementTask(controlPlane, retryPolicy, plan.getNamespace(), record);
				pool.execute(() -> {
					if (cancelled.get()) {
						return;
					}
					task.run();
					progress.update(processed.incrementAndGet());
				});
			}
		} finally {
			pool.shutdown();
			awaitTermination(pool);
		}

		ExecutionResult result = new ExecutionResult(records, cancelled.get());
		if (result.isCancelled()) {
			logger.warn("placement cancelled, {} entries not started", result.getCancelledCount());
		}
		logger.info("placement complete, {}", result);
		return result;
	}

	public void cancel() {
		if (cancelled.compareAndSet(false, true)) {
			logger.info("cancel requested, no further entries will be started");
		}
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	public int getConcurrency() {
		return concurrency;
	}

	private static void awaitTermination(ThreadPoolExecutor pool) {
		boolean interrupted = false;
		while (true) {
			try {
				if (pool.awaitTermination(PROGRESS_LOG_INTERVAL_SECONDS, TimeUnit.SECONDS)) {
					break;
				}
				logger.debug("waiting for {} running placement(s) to finish", pool.getActiveCount());
			} catch (InterruptedException e) {
				// in-flight cluster commands still have to complete before returning
				interrupted = true;
			}
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
	}

	private static class ProgressLogger {

		private final int total;
		private volatile long lastLogSeconds = System.currentTimeMillis() / 1000;

		ProgressLogger(int total) {
			this.total = total;
		}

		void update(int processed) {
			long now = System.currentTimeMillis() / 1000;
			if (now - lastLogSeconds >= PROGRESS_LOG_INTERVAL_SECONDS || processed == total) {
				lastLogSeconds = now;
				double pctComplete = total == 0 ? 100. : processed * 100. / total;
				logger.info(String.format("%.1f %% of entries processed ( %,d / %,d )", pctComplete, processed, total));
			}
		}
	}
}
