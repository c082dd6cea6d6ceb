package nl.fw.util.spinsync;

import java.util.concurrent.locks.ReentrantLock;

/**
 * An {@link ExclusiveLock} backed by a native mutex (a {@link ReentrantLock}).
 * Waiting threads are parked instead of spinning, use this lock as guard when critical sections are not short.
 * <br>Unlike {@link SpinLock}, releasing a lock that is not held by the current thread
 * always fails with an {@link IllegalMonitorStateException}.
 * <br>The lock is re-entrant: the holding thread can acquire it again and must release it as many times.
 *
 * @author vanOekel
 *
 */
public class MutexLock implements ExclusiveLock {

	private final ReentrantLock mutex;
	private final String name;

	/**
	 * A non-fair mutex.
	 */
	public MutexLock(String name) {
		this(name, false);
	}

	/**
	 * @param fair if true, the longest waiting thread gets the lock (see {@link ReentrantLock#ReentrantLock(boolean)}).
	 */
	public MutexLock(String name, boolean fair) {
		super();
		this.name = name;
		mutex = new ReentrantLock(fair);
	}

	@Override
	public boolean tryAcquire() {
		return mutex.tryLock();
	}

	@Override
	public void acquire() {
		mutex.lock();
	}

	@Override
	public void release() {
		mutex.unlock();
	}

	@Override
	public boolean isLocked() {
		return mutex.isLocked();
	}

	public boolean isHeldByCurrentThread() {
		return mutex.isHeldByCurrentThread();
	}

	public boolean isFair() {
		return mutex.isFair();
	}

	@Override public String toString() {
		return (name == null ? super.toString() : name);
	}

}
