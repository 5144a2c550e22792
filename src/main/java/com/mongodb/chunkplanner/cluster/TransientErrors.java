package com.mongodb.chunkplanner.cluster;

import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoNodeIsRecoveringException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;

/**
 * Decides which driver errors are worth retrying: network trouble, elections, timeouts
 * and metadata lock contention between concurrent split/move commands.
 */
public class TransientErrors {

	private final static Set<Integer> transientCodes = ImmutableSet.of(
			6,     // HostUnreachable
			7,     // HostNotFound
			46,    // LockBusy
			50,    // MaxTimeMSExpired
			89,    // NetworkTimeout
			91,    // ShutdownInProgress
			117,   // ConflictingOperationInProgress
			189,   // PrimarySteppedDown
			262,   // ExceededTimeLimit
			9001,  // SocketException
			10107, // NotWritablePrimary
			11600, // InterruptedAtShutdown
			11602, // InterruptedDueToReplStateChange
			13435, // NotPrimaryNoSecondaryOk
			13436  // NotPrimaryOrSecondary
	);

	private TransientErrors() {
	}

	public static boolean isTransient(Throwable t) {
		if (t instanceof MongoSocketException || t instanceof MongoTimeoutException
				|| t instanceof MongoExecutionTimeoutException || t instanceof MongoNotPrimaryException
				|| t instanceof MongoNodeIsRecoveringException) {
			return true;
		}
		if (t instanceof MongoException) {
			MongoException me = (MongoException) t;
			if (me.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
					|| me.hasErrorLabel("RetryableWriteError")) {
				return true;
			}
			if (t instanceof MongoCommandException) {
				return transientCodes.contains(((MongoCommandException) t).getErrorCode());
			}
		}
		return false;
	}
}
