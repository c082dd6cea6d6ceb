/**
 * Synchronization primitives built on a spin lock, shared state guarded by those primitives
 * and a locking protocol for code that needs more than one lock.
 * <p>
 * {@link nl.fw.util.spinsync.SpinLock} is the basic lock: an atomic flag and a busy-wait loop.
 * {@link nl.fw.util.spinsync.CountingSemaphore} uses a spin lock to guard its count.
 * {@link nl.fw.util.spinsync.GuardedCounter} and {@link nl.fw.util.spinsync.GuardedMap} carry their own guard
 * and hold it from the read until the dependent write.
 * <p>
 * Code that needs several locks at once must acquire them via an {@link nl.fw.util.spinsync.OrderedLockSet}.
 * <br>Usage example: <pre>
 * LockSetHandle handle = lockSet.acquireInOrder(accountB, accountA);
 * try {
 * 	// use resources guarded by accountA and accountB
 * } finally {
 * 	lockSet.releaseAll(handle);
 * } </pre>
 * The following is <b>not</b> allowed, another thread taking the same locks in order A-B can deadlock with it: <pre>
 * accountB.acquire();
 * try {
 * 	accountA.acquire(); // waits on A while holding B
 * 	...
 * } finally {
 * 	...
 * } </pre>
 * A lock released halfway may only be taken back without waiting: <pre>
 * lockSet.execute(handle -&gt; {
 * 	handle.suspend(lockA);
 * 	// work that needs lockB only
 * 	if (!handle.tryReacquire(lockA)) {
 * 		return; // all locks released, execute retries according to the retry policy
 * 	}
 * 	// work that needs lockA and lockB
 * }, lockA, lockB); </pre>
 * Blocking on A while still holding B would deadlock with a thread that holds A and waits for B.
 * <p>
 * {@link nl.fw.util.spinsync.SpinLock} is not re-entrant: a thread acquiring a spin lock it already holds spins forever.
 * {@link nl.fw.util.spinsync.MutexLock} is re-entrant, each acquire by the holding thread needs its own release.
 */
package nl.fw.util.spinsync;
