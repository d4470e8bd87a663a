package testing;

import java.util.concurrent.CyclicBarrier;

/**
 * Runs a block on several threads at once and rethrows the first
 * failure once all of them are joined.
 */
public class ParUtil {
	public interface Block {
		void call(int index) throws Exception;
	}

	public static void parallel(final int numThreads, final Block block) {
		final Thread[] threads = new Thread[numThreads];
		final Throwable[] failure = { null };
		final CyclicBarrier start = new CyclicBarrier(numThreads);
		for (int i = 0; i < threads.length; ++i) {
			final int index = i;
			threads[i] = new Thread("worker #" + i) {
				@Override
				public void run() {
					try {
						start.await();
						block.call(index);
					} catch (final Throwable xx) {
						synchronized (failure) {
							if (failure[0] == null)
								failure[0] = xx;
						}
					}
				}
			};
		}
		for (Thread t : threads) {
			t.start();
		}
		for (Thread t : threads) {
			try {
				t.join();
			} catch (final InterruptedException xx) {
				throw new RuntimeException("unexpected", xx);
			}
		}

		if (failure[0] instanceof RuntimeException) {
			throw (RuntimeException) failure[0];
		} else if (failure[0] instanceof Error) {
			throw (Error) failure[0];
		} else if (failure[0] != null) {
			throw new RuntimeException(failure[0]);
		}
	}
}
