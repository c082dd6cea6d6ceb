package nl.fw.util.spinsync;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

/**
 * The locks acquired by one call to {@link OrderedLockSet#acquireInOrder(java.util.Collection)},
 * keeps track of acquisition order, held and suspended locks and lock-state.
 * <br>A handle is used by one thread only and is not thread-safe.
 * <p>
 * Lock-states: <pre>
 * ACQUIRING -&gt; HELD -&gt; RELEASING -&gt; UNLOCKED
 *                 \
 *                  -&gt; ABORTED (a suspended lock could not be re-acquired) </pre>
 * Locks are released in the reverse order of acquisition. {@link #release(ExclusiveLock)} only accepts the most
 * recently acquired lock that is still held, any other lock is a programming mistake and fails with an
 * {@link IllegalStateException}.
 *
 * @author vanOekel
 *
 */
public class LockSetHandle implements AutoCloseable {

	public enum State {
		ACQUIRING,
		HELD,
		RELEASING,
		UNLOCKED,
		ABORTED
	}

	private final OrderedLockSet lockSet;
	private final String name;

	/**
	 * The locks in ascending rank, the order of acquisition.
	 */
	private final List<RankedLock> ordered;

	/**
	 * Held locks, the most recently acquired lock is last.
	 */
	private final Deque<RankedLock> held = new ArrayDeque<>();
	private final List<RankedLock> suspended = new LinkedList<>();
	private final List<ExclusiveLock> released = new ArrayList<>();

	private volatile State state = State.ACQUIRING;

	LockSetHandle(OrderedLockSet lockSet, String name, List<RankedLock> ordered) {
		super();
		this.lockSet = lockSet;
		this.name = name;
		this.ordered = ordered;
	}

	/**
	 * Acquires all locks in ascending rank.
	 * If a (runtime) exception is thrown, all locks acquired so far are released.
	 */
	void acquireAll() {

		boolean lockComplete = false;
		try {
			for (RankedLock rl : ordered) {
				rl.lock.acquire();
				held.addLast(rl);
			}
			state = State.HELD;
			lockComplete = true;
		} finally {
			if (!lockComplete) {
				releaseHeld();
				finish(State.UNLOCKED);
			}
		}
	}

	/**
	 * Releases the given lock, which must be the most recently acquired lock still held.
	 * When no locks are held anymore, the handle is unlocked.
	 * @throws IllegalStateException when the lock is not the last acquired lock.
	 */
	public void release(ExclusiveLock lock) {

		checkHeldState();
		RankedLock last = held.peekLast();
		if (last == null || last.lock != lock) {
			throw new IllegalStateException("Lock " + lock + " released out of order by " + this
					+ ", expected release of " + (last == null ? "no lock" : last.lock));
		}
		held.removeLast();
		releaseLock(last);
		if (held.isEmpty() && suspended.isEmpty()) {
			finish(State.UNLOCKED);
		}
	}

	/**
	 * Temporarily releases a held lock, regardless of acquisition order.
	 * The lock can only be taken back with {@link #tryReacquire(ExclusiveLock)}: blocking on it
	 * while other locks are held could deadlock with a thread that acquires in rank order.
	 * @throws IllegalStateException when the lock is not held by this handle.
	 */
	public void suspend(ExclusiveLock lock) {

		checkHeldState();
		RankedLock rl = removeHeld(lock);
		if (rl == null) {
			throw new IllegalStateException("Cannot suspend lock " + lock + " not held by " + this);
		}
		releaseLock(rl);
		suspended.add(rl);
	}

	/**
	 * Attempts to take back a suspended lock without waiting.
	 * If the lock is not available, all held locks are released in reverse order,
	 * the handle is aborted and the caller must not use any of the locks.
	 * @return true if the lock is held again.
	 * @throws IllegalStateException when the lock was not suspended by this handle.
	 */
	public boolean tryReacquire(ExclusiveLock lock) {

		checkHeldState();
		RankedLock rl = null;
		for (Iterator<RankedLock> it = suspended.iterator(); it.hasNext();) {
			RankedLock s = it.next();
			if (s.lock == lock) {
				rl = s;
				it.remove();
				break;
			}
		}
		if (rl == null) {
			throw new IllegalStateException("Cannot re-acquire lock " + lock + " not suspended by " + this);
		}
		if (rl.lock.tryAcquire()) {
			held.addLast(rl);
			return true;
		}
		suspended.clear();
		releaseHeld();
		finish(State.ABORTED);
		return false;
	}

	/**
	 * Releases all held locks in reverse order of acquisition.
	 * Does nothing if the handle is already unlocked or aborted.
	 */
	public void releaseAll() {

		if (state == State.UNLOCKED || state == State.ABORTED) {
			return;
		}
		state = State.RELEASING;
		suspended.clear();
		releaseHeld();
		finish(State.UNLOCKED);
	}

	/**
	 * Same as {@link #releaseAll()}.
	 */
	@Override
	public void close() {
		releaseAll();
	}

	private void checkHeldState() {

		if (state != State.HELD) {
			throw new IllegalStateException("Lock set handle " + this + " is not holding locks, state: " + state);
		}
	}

	private RankedLock removeHeld(ExclusiveLock lock) {

		for (Iterator<RankedLock> it = held.iterator(); it.hasNext();) {
			RankedLock rl = it.next();
			if (rl.lock == lock) {
				it.remove();
				return rl;
			}
		}
		return null;
	}

	private void releaseHeld() {

		RankedLock rl;
		while ((rl = held.pollLast()) != null) {
			releaseLock(rl);
		}
	}

	private void releaseLock(RankedLock rl) {

		rl.lock.release();
		released.add(rl.lock);
	}

	private void finish(State endState) {

		state = endState;
		lockSet.handleDone(this);
	}

	/* *** state methods *** */

	public State getState() {
		return state;
	}

	/**
	 * Returns true if locks are held (including the case where some locks are suspended).
	 */
	public boolean isLocked() {
		return (state == State.HELD);
	}

	public boolean isAborted() {
		return (state == State.ABORTED);
	}

	/**
	 * The locks in order of acquisition (ascending rank).
	 */
	public List<ExclusiveLock> getLocks() {

		List<ExclusiveLock> locks = new ArrayList<>(ordered.size());
		for (RankedLock rl : ordered) {
			locks.add(rl.lock);
		}
		return Collections.unmodifiableList(locks);
	}

	/**
	 * The locks currently held, the most recently acquired lock is last.
	 */
	public List<ExclusiveLock> getHeld() {

		List<ExclusiveLock> locks = new ArrayList<>(held.size());
		for (RankedLock rl : held) {
			locks.add(rl.lock);
		}
		return locks;
	}

	public boolean isHeld(ExclusiveLock lock) {

		for (RankedLock rl : held) {
			if (rl.lock == lock) {
				return true;
			}
		}
		return false;
	}

	/**
	 * All lock releases done via this handle, in order of release.
	 */
	public List<ExclusiveLock> getReleased() {
		return Collections.unmodifiableList(new ArrayList<>(released));
	}

	public String getName() {
		return name;
	}

	/**
	 * Returns name if name is set.
	 */
	@Override public String toString() {
		return (name == null ? super.toString() : name);
	}

}
