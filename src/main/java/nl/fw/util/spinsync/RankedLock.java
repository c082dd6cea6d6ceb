package nl.fw.util.spinsync;

/**
 * A lock with its position in the total lock order of an {@link OrderedLockSet}.
 * Immutable, one instance per lock per lock-set.
 *
 * @author vanOekel
 *
 */
public final class RankedLock implements Comparable<RankedLock> {

	final ExclusiveLock lock;
	final long rank;

	RankedLock(ExclusiveLock lock, long rank) {
		super();
		this.lock = lock;
		this.rank = rank;
	}

	public ExclusiveLock getLock() {
		return lock;
	}

	public long getRank() {
		return rank;
	}

	@Override
	public int compareTo(RankedLock other) {
		return Long.compare(rank, other.rank);
	}

	/**
	 * Returns lock name with rank.
	 */
	@Override public String toString() {
		return lock + "#" + rank;
	}

}
