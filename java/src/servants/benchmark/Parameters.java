package servants.benchmark;

/**
 * Parameters of the servant chain benchmark, overridden from the
 * command line by {@link Coordinator#main(String[])}.
 */
public class Parameters {

	public static int numThreads = 4,
		range = 500000,
		numContains = 0,
		iterations = 1;

	/** Shuffle seed; null draws a fresh seed per run */
	public static Long seed = null;

	public static boolean detailedStats = false;

	public static Coordinator.Mode mode = Coordinator.Mode.INSERT_ONLY;

	public static String chainClassName = "chains.lockbased.RWLockSortedChain";
}
