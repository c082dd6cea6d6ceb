package nl.fw.util.spinsync;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts occurrences per key. One guard covers the whole map
 * and the entire "check presence, then insert or increment" sequence.
 * <p>
 * Wrapping a {@link java.util.concurrent.ConcurrentHashMap} does not help when the check and the act are separate calls: <pre>
 * if (!map.containsKey(key)) {
 * 	map.put(key, 1);  // two threads can both get here, one count is lost
 * } else {
 * 	map.put(key, map.get(key) + 1);
 * } </pre>
 *
 * @author vanOekel
 *
 * @param <K> type of key
 */
public class GuardedMap<K> {

	private final ExclusiveLock guard;

	/**
	 * Only accessed while {@link #guard} is held.
	 */
	private final Map<K, Integer> counts = new HashMap<>();

	/**
	 * A map guarded by a {@link SpinLock}.
	 */
	public GuardedMap() {
		this(new SpinLock());
	}

	public GuardedMap(ExclusiveLock guard) {
		super();
		if (guard == null) {
			throw new IllegalArgumentException("Guard is required.");
		}
		this.guard = guard;
	}

	/**
	 * Inserts a count of 1 for a new key or increments the count of an existing key.
	 * @return the count for the key after the update.
	 */
	public int upsertOrIncrement(K key) {

		if (key == null) {
			throw new NullPointerException("Key cannot be null.");
		}
		guard.acquire();
		try {
			Integer count = counts.get(key);
			int updated = (count == null ? 1 : count + 1);
			counts.put(key, updated);
			return updated;
		} finally {
			guard.release();
		}
	}

	/**
	 * Returns the count for the key, 0 if the key was never inserted.
	 */
	public int get(K key) {

		guard.acquire();
		try {
			Integer count = counts.get(key);
			return (count == null ? 0 : count);
		} finally {
			guard.release();
		}
	}

	public int size() {

		guard.acquire();
		try {
			return counts.size();
		} finally {
			guard.release();
		}
	}

	/**
	 * Returns an unmodifiable copy of all counts.
	 */
	public Map<K, Integer> snapshot() {

		guard.acquire();
		try {
			return Collections.unmodifiableMap(new HashMap<>(counts));
		} finally {
			guard.release();
		}
	}

}
