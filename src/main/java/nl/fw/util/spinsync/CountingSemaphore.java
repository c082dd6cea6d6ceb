package nl.fw.util.spinsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A counting semaphore built on a {@link SpinLock}, waiting threads spin and are never parked.
 * <br>The count never goes below 0: {@link #acquire()} checks for a positive count and decrements it
 * within one acquisition of the internal spin lock.
 * <p>
 * The following is <b>not</b> correct: <pre>
 * while (count == 0) {
 * 	// spin
 * }
 * lock.acquire();
 * count--;  // another waiter may have taken the last permit, count can become -1
 * lock.release(); </pre>
 * <p>
 * By default the count has no upper bound. With a capacity, a {@link #release()} at capacity
 * is handled according to the {@link OverflowPolicy}.
 *
 * @author vanOekel
 *
 */
public class CountingSemaphore {

	private static final Logger log = LoggerFactory.getLogger(CountingSemaphore.class);

	/** Capacity value for a semaphore without upper bound. */
	public static final int UNBOUNDED = -1;

	/**
	 * What {@link CountingSemaphore#release()} does when the count is at capacity.
	 */
	public enum OverflowPolicy {
		/** Throw an {@link IllegalStateException}. */
		REJECT,
		/** Leave the count at capacity. */
		CLAMP
	}

	private final SpinLock lock = new SpinLock("semaphore-lock");
	private final int capacity;
	private final OverflowPolicy overflowPolicy;

	/**
	 * Only accessed while {@link #lock} is held.
	 */
	private int count;

	/**
	 * An unbounded semaphore.
	 * @param initialCount available permits, must be 0 or more.
	 */
	public CountingSemaphore(int initialCount) {
		this(initialCount, UNBOUNDED, OverflowPolicy.REJECT);
	}

	/**
	 * @param initialCount available permits, must be 0 or more.
	 * @param capacity maximum amount of permits or {@link #UNBOUNDED}. Must be at least initialCount.
	 * @param overflowPolicy what to do when a release exceeds the capacity.
	 */
	public CountingSemaphore(int initialCount, int capacity, OverflowPolicy overflowPolicy) {
		super();
		if (initialCount < 0) {
			throw new IllegalArgumentException("Initial count cannot be negative: " + initialCount);
		}
		if (capacity != UNBOUNDED && capacity < initialCount) {
			throw new IllegalArgumentException("Capacity " + capacity + " is less than initial count " + initialCount);
		}
		if (overflowPolicy == null) {
			throw new IllegalArgumentException("Overflow policy is required.");
		}
		this.count = initialCount;
		this.capacity = capacity;
		this.overflowPolicy = overflowPolicy;
	}

	/**
	 * Takes a permit, spins while no permit is available.
	 */
	public void acquire() {

		while (!tryAcquire()) {
			Thread.onSpinWait();
		}
	}

	/**
	 * Takes a permit if one is available.
	 * @return true if a permit was taken.
	 */
	public boolean tryAcquire() {

		lock.acquire();
		try {
			if (count > 0) {
				count--;
				return true;
			}
			return false;
		} finally {
			lock.release();
		}
	}

	/**
	 * Returns a permit.
	 * @throws IllegalStateException when the count is at capacity and the overflow policy is {@link OverflowPolicy#REJECT}.
	 */
	public void release() {

		boolean clamped = false;
		lock.acquire();
		try {
			if (capacity != UNBOUNDED && count >= capacity) {
				if (overflowPolicy == OverflowPolicy.REJECT) {
					throw new IllegalStateException("Semaphore count already at capacity " + capacity);
				}
				clamped = true;
			} else {
				count++;
			}
		} finally {
			lock.release();
		}
		if (clamped) {
			log.warn("Semaphore release ignored, count already at capacity " + capacity);
		}
	}

	/**
	 * The number of permits available after the last completed acquire or release.
	 */
	public int availablePermits() {

		lock.acquire();
		try {
			return count;
		} finally {
			lock.release();
		}
	}

	/**
	 * The maximum amount of permits, or {@link #UNBOUNDED}.
	 */
	public int getCapacity() {
		return capacity;
	}

	public OverflowPolicy getOverflowPolicy() {
		return overflowPolicy;
	}

	@Override public String toString() {
		return "CountingSemaphore[permits=" + availablePermits()
				+ (capacity == UNBOUNDED ? "" : ", capacity=" + capacity) + "]";
	}

}
