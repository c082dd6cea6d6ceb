package nl.fw.util.spinsync;

/**
 * An exclusive (mutual-exclusion) lock: at most one holder at a time.
 * Implemented by {@link SpinLock} and {@link MutexLock}, used as guard by {@link GuardedCounter},
 * {@link GuardedMap} and by the {@link OrderedLockSet} acquisition protocol.
 *
 * @author vanOekel
 *
 */
public interface ExclusiveLock {

	/**
	 * Attempts to take the lock once, never waits.
	 * @return true if the lock was taken by the caller.
	 */
	boolean tryAcquire();

	/**
	 * Takes the lock, waiting as long as needed.
	 */
	void acquire();

	/**
	 * Releases the lock. Must only be called by the current holder.
	 */
	void release();

	/**
	 * Returns true if the lock is held by some thread.
	 * The answer can be outdated by the time it is returned, use only for diagnostics and testing.
	 */
	boolean isLocked();

}
