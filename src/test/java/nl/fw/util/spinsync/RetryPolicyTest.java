package nl.fw.util.spinsync;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class RetryPolicyTest {

	@Test
	void noneNeverRetries() {

		RetryPolicy policy = RetryPolicy.none();
		assertFalse(policy.mayRetry(1));
		assertEquals(0, policy.getMaxRetries());
	}

	@Test
	void limitedRetriesCountAttempts() {

		RetryPolicy policy = RetryPolicy.limited(2, 0L);
		assertTrue(policy.mayRetry(1));
		assertTrue(policy.mayRetry(2));
		assertFalse(policy.mayRetry(3));
		assertThrows(IllegalArgumentException.class, () -> RetryPolicy.limited(0, 0L));
	}

	@Test
	void unlimitedAlwaysRetries() {

		RetryPolicy policy = RetryPolicy.unlimited(0L);
		assertTrue(policy.mayRetry(Integer.MAX_VALUE));
		assertEquals(-1, policy.getMaxRetries());
	}

	@Test
	void backoffTimeMustBeInRange() throws Exception {

		assertThrows(IllegalArgumentException.class, () -> RetryPolicy.unlimited(-1L));
		assertThrows(IllegalArgumentException.class, () -> RetryPolicy.unlimited(Long.MAX_VALUE));
		assertThrows(IllegalArgumentException.class, () -> RetryPolicy.limited(1, Long.MAX_VALUE));
		assertEquals(Long.MAX_VALUE - 1L, RetryPolicy.unlimited(Long.MAX_VALUE - 1L).getMaxBackoffMs());
		// short backoffs return
		RetryPolicy.limited(1, 1L).backoff();
		RetryPolicy.none().backoff();
	}

}
