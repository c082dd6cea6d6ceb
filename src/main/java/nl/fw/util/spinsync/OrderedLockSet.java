package nl.fw.util.spinsync;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Acquires multiple locks without deadlocks.
 * All methods are thread-safe.
 * <p>
 * Every lock gets a rank: a unique number that puts all locks in one total order.
 * {@link #acquireInOrder(Collection)} always acquires locks in ascending rank, whatever order the caller uses,
 * and locks are released in descending rank. A cycle of threads waiting on each other requires
 * at least one thread waiting on a lower ranked lock while holding a higher ranked lock, which cannot happen.
 * <p>
 * Ordering does not help a call path that gives up a lock halfway and needs it back later.
 * Such a path uses {@link LockSetHandle#suspend(ExclusiveLock)} and {@link LockSetHandle#tryReacquire(ExclusiveLock)}:
 * when the lock cannot be taken back immediately, all other locks are released and the handle is aborted.
 * {@link #execute(LockSetTask, ExclusiveLock...)} runs such a path and retries it according to the {@link RetryPolicy}.
 * <p>
 * A lock has one rank shared by all lock-sets, so different lock-sets never order the same locks differently.
 * Ranks are assigned on first use or can be registered up front with {@link #register(ExclusiveLock, long)}.
 * Locks are identified by object identity and only weakly referenced by the rank registry and the lock-set.
 *
 * @author vanOekel
 *
 */
public class OrderedLockSet {

	private static final Logger log = LoggerFactory.getLogger(OrderedLockSet.class);

	/**
	 * Locks ranked via this lock-set, guarded by {@link #usedLock}.
	 */
	private final Set<ExclusiveLock> used = Collections.newSetFromMap(new WeakHashMap<ExclusiveLock, Boolean>());
	private final SpinLock usedLock = new SpinLock("used-lock");

	/**
	 * Handles holding locks.
	 * Used to verify proper calling behavior and flush out programming mistakes.
	 */
	private final Set<LockSetHandle> handles = Collections.newSetFromMap(new ConcurrentHashMap<LockSetHandle, Boolean>());

	/**
	 * Thread-bound handles (based on "currentThread").
	 */
	private final ConcurrentHashMap<Thread, LockSetHandle> threadHandles = new ConcurrentHashMap<>();

	private final RetryPolicy retryPolicy;

	/**
	 * A lock-set that does not retry aborted tasks.
	 */
	public OrderedLockSet() {
		this(RetryPolicy.none());
	}

	public OrderedLockSet(RetryPolicy retryPolicy) {
		super();
		if (retryPolicy == null) {
			throw new IllegalArgumentException("Retry policy is required.");
		}
		this.retryPolicy = retryPolicy;
	}

	/* *** ranking *** */

	/**
	 * Returns the rank of the lock, assigns the next free rank if the lock has no rank yet.
	 * The rank is the same for all lock-sets.
	 */
	public long rank(ExclusiveLock lock) {
		return ranked(lock).rank;
	}

	/**
	 * Gives the lock a fixed rank, for all lock-sets. Must be called before the lock is used with any lock-set.
	 * Registering the same rank for the same lock again is allowed.
	 * A rank becomes available again when the lock that used it is garbage collected.
	 * @throws IllegalArgumentException when the lock already has another rank or the rank is used by another lock.
	 */
	public void register(ExclusiveLock lock, long rank) {

		LockRanks.register(lock, rank);
		markUsed(lock);
	}

	private RankedLock ranked(ExclusiveLock lock) {

		RankedLock rl = LockRanks.ranked(lock);
		markUsed(lock);
		return rl;
	}

	private void markUsed(ExclusiveLock lock) {

		usedLock.acquire();
		try {
			used.add(lock);
		} finally {
			usedLock.release();
		}
	}

	/* *** acquire and release *** */

	/**
	 * See {@link #acquireInOrder(Collection)}
	 */
	public LockSetHandle acquireInOrder(ExclusiveLock... locks) {
		return acquireInOrder(Arrays.asList(locks));
	}

	/**
	 * Acquires the given locks in ascending rank, waiting as long as needed for each lock.
	 * The same lock given twice is acquired once.
	 * <br>A call to this method must be followed by a call to {@link #releaseAll(LockSetHandle)}.
	 * If a (runtime) exception is thrown while acquiring, all locks acquired so far are released.
	 * <br>Usage example: <pre>
	 * LockSetHandle handle = lockSet.acquireInOrder(lockB, lockA);
	 * try {
	 * 	// use resources guarded by lockA and lockB
	 * } finally {
	 * 	lockSet.releaseAll(handle);
	 * } </pre>
	 * @return the handle holding all locks.
	 */
	public LockSetHandle acquireInOrder(Collection<? extends ExclusiveLock> locks) {
		return acquireInOrder(Thread.currentThread().getName(), locks);
	}

	private LockSetHandle acquireInOrder(String handleName, Collection<? extends ExclusiveLock> locks) {

		if (locks == null || locks.isEmpty()) {
			throw new IllegalArgumentException("At least one lock is required.");
		}
		TreeMap<Long, RankedLock> sorted = new TreeMap<>();
		for (ExclusiveLock lock : locks) {
			RankedLock rl = ranked(lock);
			sorted.put(rl.rank, rl);
		}
		LockSetHandle handle = new LockSetHandle(this, handleName, new ArrayList<>(sorted.values()));
		handles.add(handle);
		handle.acquireAll();
		return handle;
	}

	/**
	 * Releases all locks held by the handle in descending rank.
	 * Always place a call for this method in a finally block.
	 */
	public void releaseAll(LockSetHandle handle) {

		if (handle == null) {
			log.warn("Cannot release locks for lock set handle null");
			return;
		}
		handle.releaseAll();
	}

	/**
	 * Attempts to take back a lock suspended by the handle, see {@link LockSetHandle#tryReacquire(ExclusiveLock)}.
	 * @return false if the lock was not available, in which case the handle holds no locks anymore.
	 */
	public boolean tryReacquire(LockSetHandle handle, ExclusiveLock lock) {

		boolean reacquired = handle.tryReacquire(lock);
		if (!reacquired && log.isDebugEnabled()) {
			log.debug(handle + " could not re-acquire " + lock + ", released all locks.");
		}
		return reacquired;
	}

	/**
	 * Runs the task with all given locks held.
	 * If the task aborts its handle (via a failed {@link LockSetHandle#tryReacquire(ExclusiveLock)}),
	 * the task is run again from the start as long as the {@link RetryPolicy} allows it.
	 * All locks are released when this method returns.
	 * @return true if the task completed, false if the task was aborted and no more retries are allowed.
	 * @throws InterruptedException when the task is interrupted or the thread is interrupted during a retry backoff.
	 */
	public boolean execute(LockSetTask task, ExclusiveLock... locks) throws InterruptedException {
		return execute(task, Arrays.asList(locks));
	}

	/**
	 * See {@link #execute(LockSetTask, ExclusiveLock...)}
	 */
	public boolean execute(LockSetTask task, Collection<? extends ExclusiveLock> locks) throws InterruptedException {

		int attempts = 0;
		for (;;) {
			attempts++;
			LockSetHandle handle = acquireInOrder(locks);
			try {
				task.run(handle);
			} finally {
				handle.releaseAll();
			}
			if (!handle.isAborted()) {
				if (attempts > 1 && log.isDebugEnabled()) {
					log.debug(handle + " completed task after " + attempts + " attempts");
				}
				return true;
			}
			if (!retryPolicy.mayRetry(attempts)) {
				if (retryPolicy.getMaxRetries() != 0) {
					log.warn(handle + " gave up task after " + attempts + " attempts");
				}
				return false;
			}
			if (log.isDebugEnabled()) {
				log.debug(handle + " task aborted in attempt " + attempts + ", retrying");
			}
			retryPolicy.backoff();
		}
	}

	void handleDone(LockSetHandle handle) {
		handles.remove(handle);
	}

	/* *** Thread based locking. *** */

	/**
	 * See {@link #lock(Collection)}
	 */
	public LockSetHandle lock(ExclusiveLock... locks) {
		return lock(Arrays.asList(locks));
	}

	/**
	 * Acquires the given locks in ascending rank within the context of the current thread.
	 * Must be followed by a call to {@link #unlock()} from the same thread.
	 * <br>Usage example: <pre>
	 * lockSet.lock(lockA, lockB);
	 * try {
	 * 	// use resources guarded by lockA and lockB
	 * } finally {
	 * 	lockSet.unlock();
	 * } </pre>
	 * @throws IllegalStateException when the current thread already holds locks via this method.
	 */
	public LockSetHandle lock(Collection<? extends ExclusiveLock> locks) {

		final Thread t = Thread.currentThread();
		if (threadHandles.containsKey(t)) {
			throw new IllegalStateException("Thread " + t.getName() + " already locked a lock set. Use unlock method first.");
		}
		LockSetHandle handle = acquireInOrder(t.getName(), locks);
		threadHandles.put(t, handle);
		return handle;
	}

	/**
	 * Releases any locks held by the current thread via {@link #lock(Collection)}.
	 */
	public void unlock() {

		final LockSetHandle handle = threadHandles.remove(Thread.currentThread());
		if (handle != null) {
			handle.releaseAll();
		}
	}

	/* *** utility methods *** */

	public RetryPolicy getRetryPolicy() {
		return retryPolicy;
	}

	/**
	 * The number of handles holding locks.
	 * Should be 0 if all users have finished (e.g. after finishing a process).
	 */
	public int getSizeHandles() {
		return handles.size();
	}

	/**
	 * The number of threads holding locks via {@link #lock(Collection)}.
	 * Should be 0 if all threads have finished.
	 */
	public int getSizeThreadHandles() {
		return threadHandles.size();
	}

	/**
	 * The number of locks ranked via this lock-set (and not garbage collected).
	 */
	public int getSizeRanked() {

		usedLock.acquire();
		try {
			return used.size();
		} finally {
			usedLock.release();
		}
	}

	/**
	 * Returns true if all locks ranked via this lock-set are unlocked.
	 * Use this method with (unit) testing to ensure locks are always unlocked.
	 */
	public boolean isAllUnlocked() {

		List<ExclusiveLock> locks;
		usedLock.acquire();
		try {
			locks = new ArrayList<>(used);
		} finally {
			usedLock.release();
		}
		for (ExclusiveLock lock : locks) {
			if (lock.isLocked()) {
				return false;
			}
		}
		return true;
	}

}
