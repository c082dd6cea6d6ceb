package nl.fw.util.spinsync;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides what {@link OrderedLockSet#execute(LockSetTask, ExclusiveLock...)} does
 * when a task was aborted because a lock could not be re-acquired.
 * <br>The backoff time is random (between 0 and the maximum backoff time)
 * so that two threads aborting each other do not retry in lock-step.
 *
 * @author vanOekel
 *
 */
public final class RetryPolicy {

	private static final RetryPolicy NONE = new RetryPolicy(0, 0L);

	private final int maxRetries;
	private final long maxBackoffMs;

	private RetryPolicy(int maxRetries, long maxBackoffMs) {
		super();
		this.maxRetries = maxRetries;
		this.maxBackoffMs = maxBackoffMs;
	}

	/**
	 * An aborted task is a permanent failure, no retries.
	 */
	public static RetryPolicy none() {
		return NONE;
	}

	/**
	 * Retry an aborted task at most maxRetries times.
	 * @param maxBackoffMs maximum time to wait before a retry, 0 only yields the thread.
	 */
	public static RetryPolicy limited(int maxRetries, long maxBackoffMs) {

		if (maxRetries < 1) {
			throw new IllegalArgumentException("Maximum retries must be 1 or more, not " + maxRetries);
		}
		return new RetryPolicy(maxRetries, checkBackoff(maxBackoffMs));
	}

	/**
	 * Retry an aborted task until it completes.
	 * @param maxBackoffMs maximum time to wait before a retry, 0 only yields the thread.
	 */
	public static RetryPolicy unlimited(long maxBackoffMs) {
		return new RetryPolicy(-1, checkBackoff(maxBackoffMs));
	}

	private static long checkBackoff(long maxBackoffMs) {

		if (maxBackoffMs < 0L || maxBackoffMs == Long.MAX_VALUE) {
			throw new IllegalArgumentException("Backoff time must be between 0 and " + (Long.MAX_VALUE - 1L) + ", not " + maxBackoffMs);
		}
		return maxBackoffMs;
	}

	/**
	 * @param attempts the number of attempts done so far (1 after the first attempt).
	 * @return true if another attempt is allowed.
	 */
	public boolean mayRetry(int attempts) {
		return (maxRetries < 0 || attempts <= maxRetries);
	}

	/**
	 * Waits a random time before the next attempt.
	 * @throws InterruptedException when the thread is interrupted while waiting.
	 */
	public void backoff() throws InterruptedException {

		if (maxBackoffMs > 0L) {
			Thread.sleep(ThreadLocalRandom.current().nextLong(maxBackoffMs + 1L));
		} else {
			Thread.yield();
		}
	}

	/** -1 for unlimited retries. */
	public int getMaxRetries() {
		return maxRetries;
	}

	public long getMaxBackoffMs() {
		return maxBackoffMs;
	}

	@Override public String toString() {
		return "RetryPolicy[maxRetries=" + (maxRetries < 0 ? "unlimited" : Integer.toString(maxRetries))
				+ ", maxBackoffMs=" + maxBackoffMs + "]";
	}

}
