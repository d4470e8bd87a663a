package chains.lockbased;

import java.util.concurrent.locks.ReentrantReadWriteLock;

import servants.abstractions.SortedChain;

/**
 * A linked list implementation of the sorted chain that uses a reader
 * lock for queries and a writer lock for updates.
 *
 * The duplicate check and the splice of an insert run under the same
 * hold of the writer lock, so two servants offering the same item can
 * never both observe its absence.
 */
public class RWLockSortedChain implements SortedChain {

	final private Node head;
	final private Node tail;
	final private int maxItem;
	final private ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	public RWLockSortedChain(int maxItem) {
		if (maxItem < 0)
			throw new IllegalArgumentException("maxItem must not be negative: " + maxItem);
		this.maxItem = maxItem;
		tail = new Node(Integer.MAX_VALUE);
		head = new Node(Integer.MIN_VALUE, tail);
	}

	public boolean insert(int item) {
		if (item < 1 || item > maxItem)
			throw new IllegalArgumentException("Item " + item
					+ " outside of the chain range [1, " + maxItem + "]");
		lock.writeLock().lock();
		try {
			Node pred = head;
			Node curr = head.next;
			while (curr.key < item) {
				pred = curr;
				curr = pred.next;
			}
			if (curr.key == item) {
				return false;
			} else {
				pred.next = new Node(item, curr);
				return true;
			}
		} finally {
			lock.writeLock().unlock();
		}
	}

	public boolean contains(int item) {
		if (item < 1 || item > maxItem)
			return false;
		lock.readLock().lock();
		try {
			Node curr = head.next;
			while (curr.key < item)
				curr = curr.next;
			return curr.key == item;
		} finally {
			lock.readLock().unlock();
		}
	}

	public Integer removeFirst() {
		lock.writeLock().lock();
		try {
			Node first = head.next;
			if (first == tail)
				return null;
			head.next = first.next;
			return first.key;
		} finally {
			lock.writeLock().unlock();
		}
	}

	public int size() {
		lock.readLock().lock();
		try {
			return count();
		} finally {
			lock.readLock().unlock();
		}
	}

	/* caller holds either lock */
	private int count() {
		int size = 0;
		Node curr = head.next;
		while (curr != tail) {
			curr = curr.next;
			size++;
		}
		return size;
	}

	public boolean isEmpty() {
		lock.readLock().lock();
		try {
			return head.next == tail;
		} finally {
			lock.readLock().unlock();
		}
	}

	public int[] toArray() {
		lock.readLock().lock();
		try {
			int[] items = new int[count()];
			int i = 0;
			for (Node curr = head.next; curr != tail; curr = curr.next)
				items[i++] = curr.key;
			return items;
		} finally {
			lock.readLock().unlock();
		}
	}

	public void clear() {
		lock.writeLock().lock();
		try {
			head.next = tail;
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		lock.readLock().lock();
		try {
			for (Node curr = head.next; curr != tail; curr = curr.next) {
				if (sb.length() > 1)
					sb.append(", ");
				sb.append(curr.key);
			}
		} finally {
			lock.readLock().unlock();
		}
		return sb.append(']').toString();
	}

	/**
	 * The node of the chain
	 */
	private static class Node {
		final public int key;
		public Node next;

		Node(int item) {
			key = item;
			next = null;
		}

		Node(int item, Node n) {
			key = item;
			next = n;
		}
	}
}
