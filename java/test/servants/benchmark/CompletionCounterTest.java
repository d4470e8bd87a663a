package servants.benchmark;

import junit.framework.TestCase;
import testing.ParUtil;

public class CompletionCounterTest extends TestCase {

	public void testIncrementReturnsNewValue() {
		CompletionCounter counter = new CompletionCounter();
		assertEquals(0, counter.get());
		assertEquals(1, counter.increment());
		assertEquals(2, counter.increment());
		assertEquals(2, counter.get());
		assertEquals("2", counter.toString());
	}

	public void testConcurrentIncrementsAreNotLost() {
		final CompletionCounter counter = new CompletionCounter();
		ParUtil.parallel(8, new ParUtil.Block() {
			public void call(int index) {
				long last = 0;
				for (int i = 0; i < 100000; i++) {
					long value = counter.increment();
					assertTrue(value > last);
					last = value;
				}
			}
		});
		assertEquals(800000, counter.get());
	}
}
