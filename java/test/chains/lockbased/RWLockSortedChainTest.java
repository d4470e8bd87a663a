package chains.lockbased;

import java.util.Random;

import pools.lockbased.LockBasedItemPool;
import servants.abstractions.SortedChain;

public class RWLockSortedChainTest extends SortedChainChecks {

	@Override
	protected SortedChain newChain(int maxItem) {
		return new RWLockSortedChain(maxItem);
	}

	public void testLargeShuffledBagEndsSorted() {
		RWLockSortedChain chain = new RWLockSortedChain(1000);
		Random random = new Random(7);
		LockBasedItemPool pool = LockBasedItemPool.shuffled(1000, random);
		Integer item;
		while ((item = pool.take()) != null)
			assertTrue(chain.insert(item));
		int[] items = chain.toArray();
		assertEquals(1000, items.length);
		for (int i = 0; i < items.length; i++)
			assertEquals(i + 1, items[i]);
	}
}
