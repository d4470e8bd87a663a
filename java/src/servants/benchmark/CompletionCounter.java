package servants.benchmark;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide count of successful chain insertions. Monotonic, never
 * decremented, lock-free.
 */
public final class CompletionCounter {

	private final AtomicLong count = new AtomicLong(0);

	/** @return the new value */
	public long increment() {
		return count.incrementAndGet();
	}

	public long get() {
		return count.get();
	}

	@Override
	public String toString() {
		return Long.toString(count.get());
	}
}
