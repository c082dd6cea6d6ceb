package nl.fw.util.spinsync;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;

public class MutexLockTest {

	@Test
	void locksLikeASpinLock() throws Exception {

		MutexLock lock = new MutexLock("M", true);
		assertTrue(lock.isFair());
		lock.acquire();
		ExecutorService tp = Executors.newSingleThreadExecutor();
		try {
			assertTrue(lock.isLocked());
			assertTrue(lock.isHeldByCurrentThread());
			assertFalse(tp.submit(lock::tryAcquire).get());
		} finally {
			lock.release();
			tp.shutdownNow();
		}
		assertFalse(lock.isLocked());
		assertEquals("M", lock.toString());
	}

	@Test
	void releaseWithoutLockFails() {

		MutexLock lock = new MutexLock("M");
		assertThrows(IllegalMonitorStateException.class, lock::release);
	}

	@Test
	void holderCanAcquireAgain() {

		MutexLock lock = new MutexLock("M");
		lock.acquire();
		assertTrue(lock.tryAcquire());
		lock.release();
		assertTrue(lock.isLocked(), "one acquire is not released yet");
		lock.release();
		assertFalse(lock.isLocked());
	}

}
