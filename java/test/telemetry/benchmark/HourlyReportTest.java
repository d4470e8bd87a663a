package telemetry.benchmark;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;
import telemetry.abstractions.TemperatureReading;

public class HourlyReportTest extends TestCase {

	private static List<TemperatureReading> readings(int... temperatures) {
		List<TemperatureReading> readings = new ArrayList<TemperatureReading>();
		for (int i = 0; i < temperatures.length; i++)
			readings.add(new TemperatureReading(0, temperatures[i], i * 10L));
		return readings;
	}

	private static int[] temperatures(List<TemperatureReading> readings) {
		int[] t = new int[readings.size()];
		for (int i = 0; i < t.length; i++)
			t[i] = readings.get(i).getTemperature();
		return t;
	}

	public void testEmptyHourHasNoReport() {
		assertNull(HourlyReport.compile(Collections.<TemperatureReading> emptyList(), 100));
	}

	public void testLowestAndHighest() {
		HourlyReport report = HourlyReport.compile(
				readings(5, -40, 70, 12, -100, 33, 0, 68, -7, 21), 1000);
		assertEquals(10, report.getNumReadings());
		assertTrue(Arrays.equals(new int[] { -100, -40, -7, 0, 5 },
				temperatures(report.getLowest())));
		assertTrue(Arrays.equals(new int[] { 70, 68, 33, 21, 12 },
				temperatures(report.getHighest())));
	}

	public void testFewerThanFiveReadings() {
		HourlyReport report = HourlyReport.compile(readings(3, 1), 1000);
		assertEquals(2, report.getLowest().size());
		assertEquals(1, report.getLowest().get(0).getTemperature());
		assertEquals(3, report.getHighest().get(0).getTemperature());
	}

	public void testLargestDifferenceStaysInsideTheWindow() {
		// readings 10 ms apart; -100 and 70 are 30 ms apart
		List<TemperatureReading> readings = readings(-100, 0, 10, 70, 60);
		HourlyReport.Difference wide = HourlyReport.compile(readings, 30).getLargestDifference();
		assertEquals(170, wide.delta);
		assertEquals(0, wide.start.getTimestamp());
		assertEquals(30, wide.end.getTimestamp());

		HourlyReport.Difference narrow = HourlyReport.compile(readings, 10).getLargestDifference();
		assertEquals(100, narrow.delta);
		assertEquals(0, narrow.start.getTimestamp());
		assertEquals(10, narrow.end.getTimestamp());
	}

	public void testEarliestPairWinsTies() {
		HourlyReport.Difference d = HourlyReport.compile(readings(0, 10, 0, 10), 10).getLargestDifference();
		assertEquals(10, d.delta);
		assertEquals(0, d.start.getTimestamp());
	}

	public void testUnorderedInputIsSortedByTime() {
		List<TemperatureReading> readings = new ArrayList<TemperatureReading>();
		readings.add(new TemperatureReading(1, 50, 200));
		readings.add(new TemperatureReading(2, -50, 0));
		readings.add(new TemperatureReading(3, 0, 100));
		HourlyReport.Difference d = HourlyReport.compile(readings, 100).getLargestDifference();
		assertEquals(50, d.delta);
		assertEquals(0, d.start.getTimestamp());
	}

	public void testNoPairInsideTheWindow() {
		List<TemperatureReading> readings = new ArrayList<TemperatureReading>();
		readings.add(new TemperatureReading(0, 1, 0));
		readings.add(new TemperatureReading(0, 2, 1000));
		HourlyReport report = HourlyReport.compile(readings, 10);
		assertNull(report.getLargestDifference());
		assertTrue(report.toString().contains("n/a"));
	}

	public void testReadingRange() {
		try {
			new TemperatureReading(0, 71, 0);
			fail("expected IllegalArgumentException");
		} catch (IllegalArgumentException expected) {
		}
	}
}
