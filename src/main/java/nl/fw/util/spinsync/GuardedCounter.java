package nl.fw.util.spinsync;

/**
 * An integer counter with its guard embedded.
 * Every read-modify-write is done within one guard acquisition: the guard is taken before the read
 * and released after the dependent write.
 * <p>
 * The following is <b>not</b> thread-safe and is the reason this class exists: <pre>
 * guard.acquire();
 * boolean matches = (value == expected);
 * guard.release();
 * if (matches) {
 * 	guard.acquire();
 * 	value++; // another thread may have incremented in between
 * 	guard.release();
 * } </pre>
 * Two threads can both see a match and both increment.
 * {@link #conditionalIncrement(int)} keeps the check and the increment under one acquisition.
 *
 * @author vanOekel
 *
 */
public class GuardedCounter {

	private final ExclusiveLock guard;
	private int value;

	/**
	 * A counter starting at 0, guarded by a {@link SpinLock}.
	 */
	public GuardedCounter() {
		this(0);
	}

	/**
	 * A counter guarded by a {@link SpinLock}.
	 */
	public GuardedCounter(int initialValue) {
		this(initialValue, new SpinLock());
	}

	/**
	 * @param guard the lock guarding this counter, must not be used to guard anything else.
	 */
	public GuardedCounter(int initialValue, ExclusiveLock guard) {
		super();
		if (guard == null) {
			throw new IllegalArgumentException("Guard is required.");
		}
		this.guard = guard;
		this.value = initialValue;
	}

	/**
	 * Increments the counter by one if the counter equals the expected value.
	 * @return true if the counter was incremented.
	 */
	public boolean conditionalIncrement(int expected) {

		guard.acquire();
		try {
			if (value == expected) {
				value++;
				return true;
			}
			return false;
		} finally {
			guard.release();
		}
	}

	/**
	 * Adds delta to the counter.
	 */
	public void add(int delta) {

		guard.acquire();
		try {
			value += delta;
		} finally {
			guard.release();
		}
	}

	/**
	 * The value after the last completed update.
	 */
	public int get() {

		guard.acquire();
		try {
			return value;
		} finally {
			guard.release();
		}
	}

	@Override public String toString() {
		return Integer.toString(get());
	}

}
