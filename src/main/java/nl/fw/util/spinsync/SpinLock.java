package nl.fw.util.spinsync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A busy-wait lock on an atomic test-and-set flag.
 * <br>Waiting threads are never parked: {@link #acquire()} keeps the thread running until the lock is taken,
 * so a spin lock must only guard short critical sections.
 * There is no queue and no fairness, any waiter can win and a waiter can starve under heavy contention.
 * <p>
 * Releasing a lock that is not held is a usage error that is only checked when assertions are enabled.
 *
 * @author vanOekel
 *
 */
public class SpinLock implements ExclusiveLock {

	private final AtomicBoolean locked = new AtomicBoolean();
	private final String name;

	public SpinLock() {
		this(null);
	}

	public SpinLock(String name) {
		super();
		this.name = name;
	}

	/**
	 * One compare-and-set from unlocked to locked.
	 */
	@Override
	public boolean tryAcquire() {
		return locked.compareAndSet(false, true);
	}

	/**
	 * Spins until the lock is taken.
	 * Waiters only read the flag until it is clear, then retry the compare-and-set.
	 */
	@Override
	public void acquire() {

		while (!tryAcquire()) {
			while (locked.get()) {
				Thread.onSpinWait();
			}
		}
	}

	@Override
	public void release() {

		final boolean wasLocked = locked.getAndSet(false);
		assert wasLocked : "Released spin lock " + this + " that was not locked.";
	}

	@Override
	public boolean isLocked() {
		return locked.get();
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
