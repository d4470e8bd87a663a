package servants.abstractions;

/**
 * The unordered bag the servants draw items from.
 */
public interface ItemPool {

	/**
	 * Removes one remaining item.
	 *
	 * @return the item, or null once the pool is empty
	 */
	public Integer take();

	public int size();

	public boolean isEmpty();
}
