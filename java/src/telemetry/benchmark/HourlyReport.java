package telemetry.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import telemetry.abstractions.TemperatureReading;

/**
 * Summary of one hour of readings: the five lowest and five highest
 * temperatures and the largest temperature change observed between two
 * readings at most one comparison window apart.
 */
public final class HourlyReport {

	public static final int TOP = 5;

	private static final Comparator<TemperatureReading> BY_TEMPERATURE = new Comparator<TemperatureReading>() {
		public int compare(TemperatureReading a, TemperatureReading b) {
			return Integer.compare(a.getTemperature(), b.getTemperature());
		}
	};

	private static final Comparator<TemperatureReading> BY_TIMESTAMP = new Comparator<TemperatureReading>() {
		public int compare(TemperatureReading a, TemperatureReading b) {
			return Long.compare(a.getTimestamp(), b.getTimestamp());
		}
	};

	/** The pair of readings spanning the largest temperature change */
	public static final class Difference {
		public final TemperatureReading start;
		public final TemperatureReading end;
		public final int delta;

		Difference(TemperatureReading start, TemperatureReading end, int delta) {
			this.start = start;
			this.end = end;
			this.delta = delta;
		}
	}

	private final int numReadings;
	private final List<TemperatureReading> lowest;
	private final List<TemperatureReading> highest;
	private final Difference largestDifference;

	private HourlyReport(int numReadings, List<TemperatureReading> lowest,
			List<TemperatureReading> highest, Difference largestDifference) {
		this.numReadings = numReadings;
		this.lowest = lowest;
		this.highest = highest;
		this.largestDifference = largestDifference;
	}

	/**
	 * Compiles the report of the given readings.
	 *
	 * @param window the largest time between two compared readings, in ms
	 * @return the report, or null if there is no reading
	 */
	public static HourlyReport compile(List<TemperatureReading> readings, long window) {
		if (readings.isEmpty())
			return null;

		List<TemperatureReading> sorted = new ArrayList<TemperatureReading>(readings);
		Collections.sort(sorted, BY_TEMPERATURE);
		int top = Math.min(TOP, sorted.size());
		List<TemperatureReading> lowest = new ArrayList<TemperatureReading>(sorted.subList(0, top));
		List<TemperatureReading> highest = new ArrayList<TemperatureReading>(top);
		for (int i = sorted.size() - 1; i >= sorted.size() - top; i--)
			highest.add(sorted.get(i));

		Collections.sort(sorted, BY_TIMESTAMP);
		return new HourlyReport(readings.size(), Collections.unmodifiableList(lowest),
				Collections.unmodifiableList(highest), largestDifference(sorted, window));
	}

	/* readings sorted by timestamp; the earliest pair wins ties */
	private static Difference largestDifference(List<TemperatureReading> readings, long window) {
		Difference result = null;
		for (int i = 0; i < readings.size(); i++) {
			TemperatureReading start = readings.get(i);
			for (int j = i + 1; j < readings.size(); j++) {
				TemperatureReading end = readings.get(j);
				if (end.getTimestamp() - start.getTimestamp() > window)
					break;
				int delta = Math.abs(end.getTemperature() - start.getTemperature());
				if (result == null || delta > result.delta)
					result = new Difference(start, end, delta);
			}
		}
		return result;
	}

	public int getNumReadings() {
		return numReadings;
	}

	/** Ascending */
	public List<TemperatureReading> getLowest() {
		return lowest;
	}

	/** Descending */
	public List<TemperatureReading> getHighest() {
		return highest;
	}

	/** Null if no two readings fall within one window */
	public Difference getLargestDifference() {
		return largestDifference;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("  Readings:                 \t").append(numReadings).append('\n');
		sb.append("  Top 5 lowest temps:       \t").append(temperatures(lowest)).append('\n');
		sb.append("  Top 5 highest temps:      \t").append(temperatures(highest)).append('\n');
		sb.append("  Largest difference:       \t");
		if (largestDifference == null)
			sb.append("n/a");
		else
			sb.append(largestDifference.delta).append("F between ")
				.append(largestDifference.start.getTimestamp()).append(" and ")
				.append(largestDifference.end.getTimestamp()).append(" ms");
		return sb.toString();
	}

	private static String temperatures(List<TemperatureReading> readings) {
		StringBuilder sb = new StringBuilder();
		for (TemperatureReading r : readings) {
			if (sb.length() > 0)
				sb.append(", ");
			sb.append(r.getTemperature());
		}
		return sb.toString();
	}
}
