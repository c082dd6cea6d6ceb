package nl.fw.util.spinsync;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.WeakHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The rank registry shared by all {@link OrderedLockSet}s: one rank per lock for the lifetime of the lock,
 * so that every lock-set acquires the same locks in the same order.
 * <br>Locks are only weakly referenced: when a lock is garbage collected, its rank is removed
 * and an explicit rank used by the lock can be registered again.
 * Locks are looked up with {@link Object#equals(Object)} and {@link Object#hashCode()},
 * lock types must keep the identity based implementations from {@link Object}.
 *
 * @author vanOekel
 *
 */
final class LockRanks {

	private static final Logger log = LoggerFactory.getLogger(LockRanks.class);

	/**
	 * Guards all fields below so that a lock never gets two ranks and two locks never share a rank.
	 */
	private static final SpinLock registryLock = new SpinLock("lock-ranks");

	private static final Map<ExclusiveLock, Long> ranks = new WeakHashMap<>();
	private static final Map<Long, RankReference> owners = new HashMap<>();
	private static final ReferenceQueue<ExclusiveLock> collected = new ReferenceQueue<>();
	private static long rankSequence;

	private LockRanks() {}

	/**
	 * Returns the rank of the lock, assigns the next free rank if the lock has no rank yet.
	 */
	static RankedLock ranked(ExclusiveLock lock) {

		if (lock == null) {
			throw new IllegalArgumentException("Lock cannot be null.");
		}
		boolean added = false;
		long rank;
		registryLock.acquire();
		try {
			expunge();
			Long current = ranks.get(lock);
			if (current == null) {
				// skip ranks registered explicitly
				do {
					rank = ++rankSequence;
				} while (owners.containsKey(rank));
				add(lock, rank);
				added = true;
			} else {
				rank = current;
			}
		} finally {
			registryLock.release();
		}
		if (added && log.isDebugEnabled()) {
			log.debug("Ranked lock " + lock + "#" + rank);
		}
		return new RankedLock(lock, rank);
	}

	/**
	 * Gives the lock a fixed rank. Registering the same rank for the same lock again is allowed.
	 * @throws IllegalArgumentException when the lock already has another rank or the rank is used by another lock.
	 */
	static void register(ExclusiveLock lock, long rank) {

		if (lock == null) {
			throw new IllegalArgumentException("Lock cannot be null.");
		}
		registryLock.acquire();
		try {
			expunge();
			Long current = ranks.get(lock);
			if (current != null) {
				if (current != rank) {
					throw new IllegalArgumentException("Lock " + lock + " already has rank " + current);
				}
				return;
			}
			RankReference owner = owners.get(rank);
			if (owner != null && owner.get() != null) {
				throw new IllegalArgumentException("Rank " + rank + " already used by lock " + owner.get());
			}
			add(lock, rank);
		} finally {
			registryLock.release();
		}
		if (log.isDebugEnabled()) {
			log.debug("Registered lock " + lock + "#" + rank);
		}
	}

	/**
	 * The number of ranked locks that have not been garbage collected yet.
	 */
	static int size() {

		registryLock.acquire();
		try {
			expunge();
			return owners.size();
		} finally {
			registryLock.release();
		}
	}

	private static void add(ExclusiveLock lock, long rank) {

		ranks.put(lock, rank);
		owners.put(rank, new RankReference(lock, rank));
	}

	/**
	 * Removes the ranks of garbage collected locks. Registry lock must be held.
	 */
	private static void expunge() {

		Reference<? extends ExclusiveLock> ref;
		while ((ref = collected.poll()) != null) {
			RankReference rr = (RankReference) ref;
			if (owners.get(rr.rank) == rr) {
				owners.remove(rr.rank);
			}
		}
	}

	private static final class RankReference extends WeakReference<ExclusiveLock> {

		final long rank;

		RankReference(ExclusiveLock lock, long rank) {
			super(lock, collected);
			this.rank = rank;
		}
	}

}
