package telemetry.lockfree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

import telemetry.abstractions.TemperatureReading;

/**
 * Many-to-one channel from the sensors to the report thread, built on
 * the lock-free queue of the JDK (Michael and Scott, PODC 1996).
 *
 * Producers never block and the channel is unbounded. Only one thread
 * may drain it; delivery is FIFO per producer.
 */
public class ReadingChannel {

	private final ConcurrentLinkedQueue<TemperatureReading> queue = new ConcurrentLinkedQueue<TemperatureReading>();

	public void push(TemperatureReading reading) {
		if (reading == null)
			throw new NullPointerException("reading");
		queue.add(reading);
	}

	/**
	 * Moves every reading currently queued into the given collection.
	 *
	 * @return the number of readings moved
	 */
	public int drainTo(Collection<? super TemperatureReading> target) {
		int n = 0;
		TemperatureReading reading;
		while ((reading = queue.poll()) != null) {
			target.add(reading);
			n++;
		}
		return n;
	}

	public List<TemperatureReading> drainAll() {
		List<TemperatureReading> readings = new ArrayList<TemperatureReading>();
		drainTo(readings);
		return readings;
	}

	public boolean isEmpty() {
		return queue.isEmpty();
	}

	/** Not constant time. */
	public int size() {
		return queue.size();
	}
}
