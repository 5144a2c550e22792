package com.mongodb.chunkplanner.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.mongodb.MongoTimeoutException;

public class RetryPolicyTest {

	private final List<Long> sleeps = new ArrayList<>();
	private final RetryPolicy policy = new RetryPolicy(4, 500, 1500).withSleeper(sleeps::add);

	@Test
	public void testBackoffDoublesAndCaps() {
		assertEquals(500, policy.backoffMillis(1));
		assertEquals(1000, policy.backoffMillis(2));
		assertEquals(1500, policy.backoffMillis(3));
		assertEquals(1500, policy.backoffMillis(10));
	}

	@Test
	public void testTransientThenSuccess() throws Exception {
		AtomicInteger calls = new AtomicInteger();
		String result = policy.call("test", () -> {
			if (calls.incrementAndGet() < 3) {
				throw InMemoryCluster.socketError();
			}
			return "ok";
		});
		assertEquals("ok", result);
		assertEquals(3, calls.get());
		assertEquals(Arrays.asList(500L, 1000L), sleeps);
	}

	@Test
	public void testExhausted() {
		AtomicInteger calls = new AtomicInteger();
		RetriesExhaustedException e = assertThrows(RetriesExhaustedException.class, () -> policy.call("test", () -> {
			calls.incrementAndGet();
			throw new MongoTimeoutException("no server");
		}));
		assertEquals(4, calls.get());
		assertEquals(4, e.getAttempts());
		assertTrue(e.getCause() instanceof MongoTimeoutException);
		assertEquals(Arrays.asList(500L, 1000L, 1500L), sleeps);
	}

	@Test
	public void testPermanentErrorNotRetried() {
		IllegalStateException cause = new IllegalStateException("bad");
		RetriesExhaustedException e = assertThrows(RetriesExhaustedException.class, () -> policy.call("test", () -> {
			throw cause;
		}));
		assertEquals(1, e.getAttempts());
		assertSame(cause, e.getCause());
		assertTrue(sleeps.isEmpty());
	}

	@Test
	public void testTransientClassification() {
		assertTrue(TransientErrors.isTransient(InMemoryCluster.socketError()));
		assertTrue(TransientErrors.isTransient(InMemoryCluster.commandError(46, "LockBusy")));
		assertTrue(TransientErrors.isTransient(InMemoryCluster.commandError(117, "ConflictingOperationInProgress")));
		assertFalse(TransientErrors.isTransient(InMemoryCluster.commandError(2, "BadValue")));
		assertFalse(TransientErrors.isTransient(new IllegalArgumentException()));
	}

	@Test
	public void testInvalidMaxAttempts() {
		assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1, 1));
	}
}
