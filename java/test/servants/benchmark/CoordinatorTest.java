package servants.benchmark;

import java.util.Arrays;
import java.util.Random;

import chains.lockbased.CoarseGrainedSortedChain;
import chains.lockbased.RWLockSortedChain;
import junit.framework.TestCase;
import servants.abstractions.SortedChain;

public class CoordinatorTest extends TestCase {

	public void testShuffledPoolSingleServant() throws Exception {
		Coordinator coordinator = new Coordinator(new int[] { 3, 1, 2 }, new RWLockSortedChain(3), 1);
		coordinator.run();
		assertEquals(3, coordinator.getCompletedInsertions());
		assertTrue(Arrays.equals(new int[] { 1, 2, 3 }, coordinator.getSortedItems()));
		assertTrue(coordinator.getElapsedTime() >= 0);
		coordinator.verify();
	}

	public void testIllegalDuplicateInPool() throws Exception {
		Coordinator coordinator = new Coordinator(new int[] { 1, 1, 2 }, new RWLockSortedChain(2), 1);
		coordinator.run();
		assertEquals(2, coordinator.getCompletedInsertions());
		assertTrue(Arrays.equals(new int[] { 1, 2 }, coordinator.getSortedItems()));
		assertEquals(1, coordinator.getServantLoops()[0].failures);
		coordinator.verify();
	}

	public void testCounterMatchesItemsForEveryServantCount() throws Exception {
		for (int servants = 1; servants <= 8; servants *= 2) {
			int max = 5000;
			Coordinator coordinator = new Coordinator(max, servants);
			coordinator.run();
			assertEquals(max, coordinator.getCompletedInsertions());
			int[] items = coordinator.getSortedItems();
			assertEquals(max, items.length);
			for (int i = 0; i < max; i++)
				assertEquals(i + 1, items[i]);
			coordinator.verify();
		}
	}

	public void testDuplicatesAcrossServants() throws Exception {
		int[] items = new int[2000];
		for (int i = 0; i < items.length; i++)
			items[i] = i % 1000 + 1;
		Coordinator coordinator = new Coordinator(items, new RWLockSortedChain(1000), 4);
		coordinator.run();
		assertEquals(1000, coordinator.getCompletedInsertions());
		long failures = 0;
		for (ServantLoop loop : coordinator.getServantLoops())
			failures += loop.failures;
		assertEquals(1000, failures);
		coordinator.verify();
	}

	public void testThankYouMode() throws Exception {
		Coordinator coordinator = new Coordinator(3000, 4, new Random(3),
				Coordinator.Mode.THANK_YOU, 0, new RWLockSortedChain(3000));
		coordinator.run();
		assertEquals(3000, coordinator.getCompletedInsertions());
		assertEquals(3000, coordinator.getThankYouCards());
		assertTrue(coordinator.getChain().isEmpty());
		coordinator.verify();
	}

	public void testWithMembershipQueries() throws Exception {
		Coordinator coordinator = new Coordinator(3000, 4, new Random(5),
				Coordinator.Mode.INSERT_ONLY, 50, new RWLockSortedChain(3000));
		coordinator.run();
		long queries = 0;
		for (ServantLoop loop : coordinator.getServantLoops())
			queries += loop.numContains;
		assertTrue(queries > 0);
		coordinator.printStats(true);
		coordinator.verify();
	}

	public void testMainRunsAndVerifies() throws Exception {
		int threads = Parameters.numThreads, range = Parameters.range, iterations = Parameters.iterations;
		Long seed = Parameters.seed;
		boolean detailed = Parameters.detailedStats;
		try {
			Coordinator.main(new String[] { "-t", "3", "-r", "2000", "-n", "2", "-s", "11", "-v" });
			Coordinator.main(new String[] { "-t", "2", "-r", "0", "-n", "1", "-s", "11" });
		} finally {
			Parameters.numThreads = threads;
			Parameters.range = range;
			Parameters.iterations = iterations;
			Parameters.seed = seed;
			Parameters.detailedStats = detailed;
		}
	}

	public void testEmptyRange() throws Exception {
		Coordinator coordinator = new Coordinator(0, 2);
		coordinator.run();
		assertEquals(0, coordinator.getCompletedInsertions());
		assertEquals(0, coordinator.getSortedItems().length);
		assertTrue(coordinator.getChain().isEmpty());
		coordinator.verify();

		coordinator = new Coordinator(0, 2, new Random(1),
				Coordinator.Mode.THANK_YOU, 50, new CoarseGrainedSortedChain(0));
		coordinator.run();
		assertEquals(0, coordinator.getThankYouCards());
		coordinator.verify();
	}

	public void testCoarseGrainedChain() throws Exception {
		Coordinator coordinator = new Coordinator(3000, 4, new Random(9),
				Coordinator.Mode.INSERT_ONLY, 10, new CoarseGrainedSortedChain(3000));
		coordinator.run();
		coordinator.verify();
	}

	public void testRunOnlyOnce() throws Exception {
		Coordinator coordinator = new Coordinator(10, 2);
		coordinator.run();
		try {
			coordinator.run();
			fail("expected IllegalStateException");
		} catch (IllegalStateException expected) {
		}
	}

	public void testVerifyBeforeRun() {
		try {
			new Coordinator(10, 2).verify();
			fail("expected IllegalStateException");
		} catch (IllegalStateException expected) {
		}
	}

	public void testVerifyDetectsTamperedChain() throws Exception {
		Coordinator coordinator = new Coordinator(100, 2);
		coordinator.run();
		coordinator.getChain().removeFirst();
		try {
			coordinator.verify();
			fail("expected IllegalStateException");
		} catch (IllegalStateException expected) {
		}
	}

	public void testServantFailureIsRethrown() throws Exception {
		Coordinator coordinator = new Coordinator(new int[] { 1, 2, 50 }, new RWLockSortedChain(10), 2);
		try {
			coordinator.run();
			fail("expected IllegalArgumentException");
		} catch (IllegalArgumentException expected) {
		}
		for (ServantLoop loop : coordinator.getServantLoops())
			assertEquals(ServantLoop.State.FINISHED, loop.getState());
	}

	public void testNeedsAServant() {
		try {
			new Coordinator(10, 0);
			fail("expected IllegalArgumentException");
		} catch (IllegalArgumentException expected) {
		}
	}

	public void testInstanciateChain() {
		SortedChain chain = Coordinator.instanciateChain("chains.lockbased.CoarseGrainedSortedChain", 10);
		assertTrue(chain instanceof CoarseGrainedSortedChain);
		assertTrue(chain.insert(10));
		try {
			Coordinator.instanciateChain("chains.lockbased.NoSuchChain", 10);
			fail("expected IllegalArgumentException");
		} catch (IllegalArgumentException expected) {
		}
		try {
			Coordinator.instanciateChain("java.lang.String", 10);
			fail("expected IllegalArgumentException");
		} catch (IllegalArgumentException expected) {
		}
	}

	public void testCommandLine() {
		int threads = Parameters.numThreads, range = Parameters.range;
		Coordinator.Mode mode = Parameters.mode;
		try {
			Coordinator.parseCommandLineParameters(new String[] {
					"-t", "2", "--range", "1000", "-m", "thank-you", "-r", "oops" });
			assertEquals(2, Parameters.numThreads);
			assertEquals(1000, Parameters.range);
			assertEquals(Coordinator.Mode.THANK_YOU, Parameters.mode);
		} finally {
			Parameters.numThreads = threads;
			Parameters.range = range;
			Parameters.mode = mode;
		}
	}

	public void testParseMode() {
		assertEquals(Coordinator.Mode.INSERT_ONLY, Coordinator.parseMode("insert"));
		assertEquals(Coordinator.Mode.THANK_YOU, Coordinator.parseMode("thank-you"));
		try {
			Coordinator.parseMode("sleep");
			fail("expected IllegalArgumentException");
		} catch (IllegalArgumentException expected) {
		}
	}
}
