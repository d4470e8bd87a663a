package servants.benchmark;

import java.lang.reflect.Constructor;
import java.util.Arrays;
import java.util.Formatter;
import java.util.Locale;
import java.util.Random;

import chains.lockbased.RWLockSortedChain;
import pools.lockbased.LockBasedItemPool;
import servants.abstractions.ItemPool;
import servants.abstractions.SortedChain;

/**
 * Creates the bag of presents, the chain and the completion counter,
 * lets the servants drain the bag onto the chain and reports the
 * final count.
 *
 * The three structures are handed to every servant as shared handles
 * and live until the last servant is joined.
 */
public class Coordinator {

	public static final String VERSION = "1.0";

	public enum Mode {
		/** Servants only hook presents onto the chain */
		INSERT_ONLY,
		/** Servants alternate between hooking presents and writing cards */
		THANK_YOU
	}

	private final ItemPool pool;
	private final SortedChain chain;
	private final CompletionCounter completions = new CompletionCounter();
	private final CompletionCounter thankYouCards = new CompletionCounter();
	/** The distinct items of the pool, ascending */
	private final int[] expected;
	private final int numServants;
	private final Mode mode;
	private final int containsRatio;
	private final int range;

	/** The array of threads executing the servants */
	private Thread[] threads;
	/** The array of runnable servant codes */
	private ServantLoop[] servantLoops;
	/** The observed duration of the run, in seconds */
	private double elapsedTime;
	private boolean started = false;

	public Coordinator(int maxItem, int numServants) {
		this(maxItem, numServants, new Random(), Mode.INSERT_ONLY, 0,
				new RWLockSortedChain(maxItem));
	}

	public Coordinator(int maxItem, int numServants, Random random, Mode mode,
			int containsRatio, SortedChain chain) {
		this(LockBasedItemPool.shuffled(maxItem, random), ascending(maxItem), chain,
				numServants, mode, containsRatio, maxItem);
	}

	/**
	 * Runs the protocol over an explicit bag; the last item is drawn
	 * first. Duplicates reach the chain, which rejects them.
	 */
	public Coordinator(int[] items, SortedChain chain, int numServants) {
		this(new LockBasedItemPool(items), distinct(items), chain, numServants,
				Mode.INSERT_ONLY, 0, 1);
	}

	private Coordinator(ItemPool pool, int[] expected, SortedChain chain,
			int numServants, Mode mode, int containsRatio, int range) {
		if (numServants < 1)
			throw new IllegalArgumentException("At least one servant is needed: " + numServants);
		if (chain == null || mode == null)
			throw new NullPointerException();
		this.pool = pool;
		this.expected = expected;
		this.chain = chain;
		this.numServants = numServants;
		this.mode = mode;
		this.containsRatio = containsRatio;
		this.range = Math.max(range, 1);
	}

	private static int[] ascending(int maxItem) {
		int[] items = new int[Math.max(maxItem, 0)];
		for (int i = 0; i < items.length; i++)
			items[i] = i + 1;
		return items;
	}

	private static int[] distinct(int[] items) {
		int[] sorted = items.clone();
		Arrays.sort(sorted);
		int n = 0;
		for (int i = 0; i < sorted.length; i++)
			if (n == 0 || sorted[n - 1] != sorted[i])
				sorted[n++] = sorted[i];
		return Arrays.copyOf(sorted, n);
	}

	/**
	 * Instantiate the chain implementation from its class name. The class
	 * must implement {@link SortedChain} and expose a constructor taking
	 * the largest item.
	 */
	public static SortedChain instanciateChain(String chainName, int maxItem) {
		try {
			Class<?> chainClass = Class.forName(chainName);
			if (!SortedChain.class.isAssignableFrom(chainClass))
				throw new IllegalArgumentException(chainName + " is not a sorted chain");
			Constructor<?> c = chainClass.getConstructor(int.class);
			return (SortedChain) c.newInstance(maxItem);
		} catch (ReflectiveOperationException e) {
			System.err.println("Cannot find chain class: " + chainName);
			throw new IllegalArgumentException("Cannot instantiate " + chainName, e);
		}
	}

	/**
	 * Creates as many servants as requested
	 */
	private void initThreads(final Throwable[] failure) {
		servantLoops = new ServantLoop[numServants];
		threads = new Thread[numServants];
		for (short threadNum = 0; threadNum < numServants; threadNum++) {
			servantLoops[threadNum] = new ServantLoop(threadNum, pool, chain,
					completions, thankYouCards, mode, containsRatio, range);
			threads[threadNum] = new Thread(servantLoops[threadNum], "servant #" + threadNum);
			threads[threadNum].setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
				public void uncaughtException(Thread t, Throwable e) {
					synchronized (failure) {
						if (failure[0] == null)
							failure[0] = e;
					}
				}
			});
		}
	}

	/**
	 * Starts the servants and blocks until every one of them has
	 * finished. A servant failure is rethrown once all are joined.
	 *
	 * @throws InterruptedException if interrupted while joining
	 */
	public void run() throws InterruptedException {
		synchronized (this) {
			if (started)
				throw new IllegalStateException("The servants have already run");
			started = true;
		}
		final Throwable[] failure = { null };
		initThreads(failure);

		long startTime = System.currentTimeMillis();
		for (Thread thread : threads)
			thread.start();
		for (Thread thread : threads)
			thread.join();
		long endTime = System.currentTimeMillis();
		elapsedTime = ((double) (endTime - startTime)) / 1000.0;

		synchronized (failure) {
			if (failure[0] instanceof RuntimeException)
				throw (RuntimeException) failure[0];
			else if (failure[0] instanceof Error)
				throw (Error) failure[0];
			else if (failure[0] != null)
				throw new RuntimeException("Servant failed", failure[0]);
		}
	}

	public long getCompletedInsertions() {
		return completions.get();
	}

	public long getThankYouCards() {
		return thankYouCards.get();
	}

	public SortedChain getChain() {
		return chain;
	}

	public int[] getSortedItems() {
		return chain.toArray();
	}

	public double getElapsedTime() {
		return elapsedTime;
	}

	public ServantLoop[] getServantLoops() {
		return servantLoops;
	}

	/**
	 * Checks the final state against the bag the run started from.
	 *
	 * @throws IllegalStateException on any mismatch
	 */
	public void verify() {
		if (servantLoops == null)
			throw new IllegalStateException("The servants have not run yet");
		for (ServantLoop loop : servantLoops)
			if (loop.getState() != ServantLoop.State.FINISHED)
				throw new IllegalStateException("Servant #" + loop.myThreadNum + " has not finished");
		if (completions.get() != expected.length)
			throw new IllegalStateException("Expected " + expected.length
					+ " insertions but counted " + completions.get());
		switch (mode) {
		case INSERT_ONLY:
			int[] items = chain.toArray();
			if (!Arrays.equals(expected, items))
				throw new IllegalStateException("Chain does not hold the "
						+ expected.length + " presents in ascending order (size "
						+ items.length + ")");
			break;
		case THANK_YOU:
			if (thankYouCards.get() != expected.length)
				throw new IllegalStateException("Expected " + expected.length
						+ " thank-you cards but counted " + thankYouCards.get());
			if (!chain.isEmpty())
				throw new IllegalStateException("Chain still holds " + chain.size() + " presents");
			break;
		}
	}

	public static void main(String[] args) throws InterruptedException {
		printHeader();
		try {
			parseCommandLineParameters(args);
		} catch (Exception e) {
			System.err.println("Cannot parse parameters.");
			e.printStackTrace();
		}
		printParams();

		for (int i = 0; i < Parameters.iterations; i++) {
			Random random = Parameters.seed == null ? new Random() : new Random(Parameters.seed + i);
			SortedChain chain = instanciateChain(Parameters.chainClassName, Parameters.range);
			Coordinator coordinator = new Coordinator(Parameters.range, Parameters.numThreads,
					random, Parameters.mode, Parameters.numContains, chain);
			coordinator.run();
			coordinator.printStats(Parameters.detailedStats);
			coordinator.verify();
			System.out.println("  Verified:                \tyes");
		}
	}

	/* ---------------- Input/Output -------------- */

	/**
	 * Parse the parameters on the command line
	 */
	static void parseCommandLineParameters(String[] args) {
		int argNumber = 0;

		while (argNumber < args.length) {
			String currentArg = args[argNumber++];

			try {
				if (currentArg.equals("--help") || currentArg.equals("-h")) {
					printUsage();
					System.exit(0);
				} else if (currentArg.equals("--verbose")
						|| currentArg.equals("-v")) {
					Parameters.detailedStats = true;
				} else {
					String optionValue = args[argNumber++];
					if (currentArg.equals("--thread-nums")
							|| currentArg.equals("-t"))
						Parameters.numThreads = Integer.parseInt(optionValue);
					else if (currentArg.equals("--range")
							|| currentArg.equals("-r"))
						Parameters.range = Integer.parseInt(optionValue);
					else if (currentArg.equals("--contains")
							|| currentArg.equals("-c"))
						Parameters.numContains = Integer.parseInt(optionValue);
					else if (currentArg.equals("--mode")
							|| currentArg.equals("-m"))
						Parameters.mode = parseMode(optionValue);
					else if (currentArg.equals("--benchmark")
							|| currentArg.equals("-b"))
						Parameters.chainClassName = optionValue;
					else if (currentArg.equals("--iterations")
							|| currentArg.equals("-n"))
						Parameters.iterations = Integer.parseInt(optionValue);
					else if (currentArg.equals("--seed")
							|| currentArg.equals("-s"))
						Parameters.seed = Long.parseLong(optionValue);
					else
						System.err.println("Unknown option: " + currentArg + ". Ignoring...");
				}
			} catch (IndexOutOfBoundsException e) {
				System.err.println("Missing value after option: " + currentArg
						+ ". Ignoring...");
			} catch (NumberFormatException e) {
				System.err.println("Number expected after option:  "
						+ currentArg + ". Ignoring...");
			} catch (IllegalArgumentException e) {
				System.err.println(e.getMessage() + ". Ignoring...");
			}
		}
	}

	static Mode parseMode(String value) {
		if (value.equals("insert"))
			return Mode.INSERT_ONLY;
		if (value.equals("thank-you"))
			return Mode.THANK_YOU;
		throw new IllegalArgumentException("Unknown mode: " + value);
	}

	/**
	 * Print a 80 character line filled with the same marker character
	 *
	 * @param ch
	 *            the marker character
	 */
	private static void printLine(char ch) {
		StringBuilder line = new StringBuilder(79);
		for (int i = 0; i < 79; i++)
			line.append(ch);
		System.out.println(line);
	}

	/**
	 * Print the header message on the standard output
	 */
	private static void printHeader() {
		String header = "Servant chain benchmark " + VERSION + "\n"
				+ "Servants drain a bag of presents onto a shared sorted chain";
		printLine('-');
		System.out.println(header);
		printLine('-');
		System.out.println();
	}

	/**
	 * Print the usage on the standard error
	 */
	private static void printUsage() {
		String syntax = "Usage:\n"
				+ "java servants.benchmark.Coordinator [options]\n\n"
				+ "Options:\n"
				+ "\t-v            -- print per-servant statistics (default: "
				+ Parameters.detailedStats
				+ ")\n"
				+ "\t-t thread-num -- set the number of servants (default: "
				+ Parameters.numThreads
				+ ")\n"
				+ "\t-r range      -- set the number of presents (default: "
				+ Parameters.range
				+ ")\n"
				+ "\t-c contains   -- set the percentage of membership queries (default: "
				+ Parameters.numContains
				+ ")\n"
				+ "\t-m mode       -- insert | thank-you (default: insert)\n"
				+ "\t-b benchmark  -- set the chain class (default: "
				+ Parameters.chainClassName
				+ ")\n"
				+ "\t-n iterations -- set the runs in the same JVM (default: "
				+ Parameters.iterations
				+ ")\n"
				+ "\t-s seed       -- set the shuffle seed (default: random)";
		System.err.println(syntax);
	}

	/**
	 * Print the parameters that have been given as an input
	 */
	private static void printParams() {
		String params = "Benchmark parameters" + "\n" + "--------------------"
				+ "\n" + "  Detailed stats:          \t"
				+ (Parameters.detailedStats ? "enabled" : "disabled")
				+ "\n"
				+ "  Number of servants:      \t"
				+ Parameters.numThreads
				+ "\n"
				+ "  Presents:                \t"
				+ Parameters.range
				+ " elts\n"
				+ "  Contains ratio:          \t"
				+ Parameters.numContains
				+ " %\n"
				+ "  Mode:                    \t"
				+ Parameters.mode
				+ "\n"
				+ "  Iterations:              \t"
				+ Parameters.iterations
				+ "\n"
				+ "  Chain:                   \t"
				+ Parameters.chainClassName;
		System.out.println(params);
	}

	/**
	 * Print the statistics on the standard output
	 */
	public void printStats(boolean detailed) {
		long numInsert = 0, numRemove = 0, numContains = 0, numContainsHit = 0,
				failures = 0, total = 0;
		for (ServantLoop loop : servantLoops) {
			numInsert += loop.numInsert;
			numRemove += loop.numRemove;
			numContains += loop.numContains;
			numContainsHit += loop.numContainsHit;
			failures += loop.failures;
			total += loop.total;
		}
		printLine('-');
		System.out.println("Benchmark statistics");
		printLine('-');
		System.out.println("  Throughput (ops/s):       \t" + formatDouble(total / Math.max(elapsedTime, 0.001)));
		System.out.println("  Elapsed time (s):         \t" + elapsedTime);
		System.out.println("  Operations:               \t" + total + "\t( 100 %)");
		System.out.println("    |--insert successful:  \t" + numInsert + "\t( "
				+ formatDouble(percent(numInsert, total)) + " %)");
		System.out.println("    |--thank-you cards:    \t" + numRemove + "\t( "
				+ formatDouble(percent(numRemove, total)) + " %)");
		System.out.println("    duplicates rejected:   \t" + failures + "\t( "
				+ formatDouble(percent(failures, total)) + " %)");
		System.out.println("    contains queries:      \t" + numContains
				+ "\t( " + numContainsHit + " on the chain)");
		System.out.println("  Completion counter:       \t" + completions.get());
		System.out.println("  Expected count:           \t" + expected.length);
		System.out.println("  Final chain size:         \t" + chain.size());
		if (detailed) {
			for (ServantLoop loop : servantLoops)
				System.out.println("    servant #" + loop.myThreadNum + ":           \t"
						+ loop.numInsert + " inserted, " + loop.numRemove + " cards, "
						+ loop.failures + " rejected");
		}
	}

	private static double percent(long part, long total) {
		return total == 0 ? 0.0 : ((double) part / (double) total) * 100;
	}

	private static String formatDouble(double result) {
		Formatter formatter = new Formatter(Locale.US);
		return formatter.format("%.2f", result).out().toString();
	}
}
