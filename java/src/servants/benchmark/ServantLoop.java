package servants.benchmark;

import java.util.Random;

import servants.abstractions.ItemPool;
import servants.abstractions.SortedChain;

/**
 * The loop executed by each servant: draw a present from the pool, hook
 * it at its place on the chain and count it, until the pool is empty.
 *
 * In {@link Coordinator.Mode#THANK_YOU} the servant alternates between
 * adding a present and unhooking the smallest one to write its card, and
 * only stops once both the pool and the chain are empty.
 */
public class ServantLoop implements Runnable {

	public enum State {
		RUNNING, FINISHED
	}

	/** Shared handles, owned jointly with the coordinator */
	private final ItemPool pool;
	private final SortedChain chain;
	private final CompletionCounter completions;
	private final CompletionCounter thankYouCards;

	private final Coordinator.Mode mode;
	/** Percentage of iterations that also query the chain */
	private final int containsRatio;
	private final int range;
	/** The number of the current servant */
	protected final short myThreadNum;

	private volatile State state = State.RUNNING;

	/** The counters of the servant successful operations */
	public long numInsert = 0;
	public long numRemove = 0;
	public long numContains = 0;
	public long numContainsHit = 0;
	/** The counter of rejected duplicates */
	public long failures = 0;
	/** The counter of the servant iterations */
	public long total = 0;

	Random rand = new Random();

	public ServantLoop(short myThreadNum, ItemPool pool, SortedChain chain,
			CompletionCounter completions, CompletionCounter thankYouCards,
			Coordinator.Mode mode, int containsRatio, int range) {
		if (containsRatio < 0 || containsRatio > 100)
			throw new IllegalArgumentException("containsRatio must be a percentage: " + containsRatio);
		this.myThreadNum = myThreadNum;
		this.pool = pool;
		this.chain = chain;
		this.completions = completions;
		this.thankYouCards = thankYouCards;
		this.mode = mode;
		this.containsRatio = containsRatio;
		this.range = range;
	}

	public ServantLoop(short myThreadNum, ItemPool pool, SortedChain chain,
			CompletionCounter completions) {
		this(myThreadNum, pool, chain, completions, new CompletionCounter(),
				Coordinator.Mode.INSERT_ONLY, 0, 1);
	}

	public State getState() {
		return state;
	}

	public void run() {
		try {
			if (mode == Coordinator.Mode.THANK_YOU)
				alternate();
			else
				drain();
		} finally {
			state = State.FINISHED;
		}
	}

	private void drain() {
		while (true) {
			query();
			if (!addPresent())
				return;
		}
	}

	private void alternate() {
		boolean adding = true;
		while (true) {
			query();
			if (adding) {
				if (!addPresent() && chain.isEmpty() && pool.isEmpty())
					return;
			} else {
				if (!writeCard() && pool.isEmpty() && chain.isEmpty())
					return;
			}
			adding = !adding;
		}
	}

	/**
	 * @return false once the pool is exhausted
	 */
	private boolean addPresent() {
		Integer present = pool.take();
		if (present == null)
			return false;
		if (chain.insert(present)) {
			completions.increment();
			numInsert++;
		} else {
			failures++;
		}
		total++;
		return true;
	}

	/**
	 * @return false if there was no present on the chain
	 */
	private boolean writeCard() {
		Integer present = chain.removeFirst();
		if (present == null)
			return false;
		thankYouCards.increment();
		numRemove++;
		total++;
		return true;
	}

	private void query() {
		if (containsRatio == 0 || rand.nextInt(100) >= containsRatio)
			return;
		numContains++;
		if (chain.contains(rand.nextInt(range) + 1))
			numContainsHit++;
	}
}
