package servants.abstractions;

/**
 * An ascending, duplicate-free sequence of item identifiers shared by
 * the servants.
 *
 * Implementations must perform the membership check and the splice of
 * {@link #insert(int)} as a single critical section. {@link #contains(int)}
 * is a pure query and must never be used to decide a later, separate write.
 */
public interface SortedChain {

	/**
	 * Inserts the item at its ascending position.
	 *
	 * @return true if the chain changed, false if the item was already there
	 * @throws IllegalArgumentException if the item is outside [1, maxItem]
	 */
	public boolean insert(int item);

	public boolean contains(int item);

	/**
	 * Unlinks the smallest item.
	 *
	 * @return the removed item, or null if the chain is empty
	 */
	public Integer removeFirst();

	public int size();

	public boolean isEmpty();

	/** Ascending snapshot of the chain. */
	public int[] toArray();

	public void clear();

	public String toString();
}
