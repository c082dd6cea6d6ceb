package nl.fw.util.spinsync;

/**
 * Work done while holding the locks of a {@link LockSetHandle},
 * see {@link OrderedLockSet#execute(LockSetTask, ExclusiveLock...)}.
 * <br>A task that needs a lock back after suspending it must use {@link LockSetHandle#tryReacquire(ExclusiveLock)}
 * and return as soon as that fails.
 *
 * @author vanOekel
 *
 */
@FunctionalInterface
public interface LockSetTask {

	void run(LockSetHandle handle) throws InterruptedException;

}
