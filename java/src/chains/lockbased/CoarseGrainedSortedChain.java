package chains.lockbased;

import java.util.Arrays;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import servants.abstractions.SortedChain;

/**
 * Baseline sorted chain guarded by a single mutual exclusion lock:
 * queries serialize with each other as well as with updates.
 */
public class CoarseGrainedSortedChain implements SortedChain {

	// sentinel nodes
	private final Node head;
	private final Node tail;
	private final int maxItem;
	private final Lock lock = new ReentrantLock();

	public CoarseGrainedSortedChain(int maxItem) {
		if (maxItem < 0)
			throw new IllegalArgumentException("maxItem must not be negative: " + maxItem);
		this.maxItem = maxItem;
		head = new Node(Integer.MIN_VALUE);
		tail = new Node(Integer.MAX_VALUE);
		head.next = tail;
	}

	/*
	 * Insert
	 *
	 * @see servants.abstractions.SortedChain#insert(int)
	 */
	public boolean insert(int item) {
		if (item < 1 || item > maxItem)
			throw new IllegalArgumentException("Item " + item
					+ " outside of the chain range [1, " + maxItem + "]");
		lock.lock();
		try {
			Node pred = head;
			Node curr = head.next;
			while (curr.key < item) {
				pred = curr;
				curr = pred.next;
			}
			if (curr.key == item) {
				return false;
			}
			Node node = new Node(item);
			node.next = curr;
			pred.next = node;
			return true;
		} finally {
			lock.unlock();
		}
	}

	public boolean contains(int item) {
		if (item < 1 || item > maxItem)
			return false;
		lock.lock();
		try {
			Node curr = head.next;
			while (curr.key < item)
				curr = curr.next;
			return curr.key == item;
		} finally {
			lock.unlock();
		}
	}

	public Integer removeFirst() {
		lock.lock();
		try {
			Node first = head.next;
			if (first == tail)
				return null;
			head.next = first.next;
			return first.key;
		} finally {
			lock.unlock();
		}
	}

	public int size() {
		lock.lock();
		try {
			return count();
		} finally {
			lock.unlock();
		}
	}

	private int count() {
		int size = 0;
		for (Node curr = head.next; curr != tail; curr = curr.next)
			size++;
		return size;
	}

	public boolean isEmpty() {
		lock.lock();
		try {
			return head.next == tail;
		} finally {
			lock.unlock();
		}
	}

	public int[] toArray() {
		lock.lock();
		try {
			int[] items = new int[count()];
			int i = 0;
			for (Node curr = head.next; curr != tail; curr = curr.next)
				items[i++] = curr.key;
			return items;
		} finally {
			lock.unlock();
		}
	}

	public void clear() {
		lock.lock();
		try {
			head.next = tail;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public String toString() {
		return Arrays.toString(toArray());
	}

	private static class Node {
		final int key;
		Node next;

		Node(int item) {
			key = item;
		}
	}
}
