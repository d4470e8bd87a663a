package pools.lockbased;

import java.util.Random;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import servants.abstractions.ItemPool;

/**
 * An array-backed bag of items guarded by a single lock. Every access
 * mutates, so there is no reader/writer split.
 *
 * Items are drawn from the top of the bag (the end of the array) and
 * the bag never regrows.
 */
public class LockBasedItemPool implements ItemPool {

	private final int[] items;
	private int remaining;
	private final Lock lock = new ReentrantLock();

	/**
	 * Builds a bag holding the given items; the last one is drawn first.
	 * Duplicates are kept as given.
	 */
	public LockBasedItemPool(int[] items) {
		if (items == null)
			throw new NullPointerException("items");
		this.items = items.clone();
		this.remaining = this.items.length;
	}

	/**
	 * Builds a bag holding 1..max in a random order (Fisher-Yates).
	 */
	public static LockBasedItemPool shuffled(int max, Random random) {
		if (max < 0)
			throw new IllegalArgumentException("max must not be negative: " + max);
		int[] items = new int[max];
		for (int i = 0; i < max; i++)
			items[i] = i + 1;
		for (int i = max - 1; i > 0; i--) {
			int j = random.nextInt(i + 1);
			int tmp = items[i];
			items[i] = items[j];
			items[j] = tmp;
		}
		return new LockBasedItemPool(items);
	}

	public Integer take() {
		lock.lock();
		try {
			if (remaining == 0)
				return null;
			return items[--remaining];
		} finally {
			lock.unlock();
		}
	}

	public int size() {
		lock.lock();
		try {
			return remaining;
		} finally {
			lock.unlock();
		}
	}

	public boolean isEmpty() {
		return size() == 0;
	}
}
