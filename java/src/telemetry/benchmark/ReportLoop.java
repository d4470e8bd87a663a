package telemetry.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import telemetry.abstractions.TemperatureReading;
import telemetry.lockfree.ReadingChannel;

/**
 * The single consumer of the channel. Every poll period it drains the
 * pending readings into the current hour; every report period it
 * compiles the hour into an {@link HourlyReport}. The loop ends on its
 * own once {@code maxReports} reports exist. When stopped earlier, the
 * readings gathered since the last report are compiled one final time.
 */
public class ReportLoop implements Runnable {

	private final ReadingChannel channel;
	private final long pollPeriod;
	private final long reportPeriod;
	private final long window;
	private final int maxReports;
	/** The stop flag, indicating whether the loop is over */
	protected volatile boolean stop = false;

	private final List<TemperatureReading> hour = new ArrayList<TemperatureReading>();
	private final List<HourlyReport> reports = Collections.synchronizedList(new ArrayList<HourlyReport>());

	public ReportLoop(ReadingChannel channel, long pollPeriod, long reportPeriod, long window) {
		this(channel, pollPeriod, reportPeriod, window, Integer.MAX_VALUE);
	}

	public ReportLoop(ReadingChannel channel, long pollPeriod, long reportPeriod, long window, int maxReports) {
		if (maxReports < 1)
			throw new IllegalArgumentException("At least one report is needed: " + maxReports);
		this.channel = channel;
		this.pollPeriod = pollPeriod;
		this.reportPeriod = reportPeriod;
		this.window = window;
		this.maxReports = maxReports;
	}

	public void stopThread() {
		stop = true;
	}

	public List<HourlyReport> getReports() {
		synchronized (reports) {
			return new ArrayList<HourlyReport>(reports);
		}
	}

	/**
	 * Compiles the readings gathered so far, including the ones still in
	 * the channel, and starts a new hour.
	 */
	HourlyReport report() {
		channel.drainTo(hour);
		HourlyReport report = HourlyReport.compile(hour, window);
		hour.clear();
		if (report == null) {
			System.err.println("No recordings available to compare, skipping report");
			return null;
		}
		reports.add(report);
		System.out.println("A new report has been generated");
		System.out.println(report);
		return report;
	}

	public void run() {
		long nextReport = System.currentTimeMillis() + reportPeriod;
		while (!stop && reports.size() < maxReports) {
			long now = System.currentTimeMillis();
			if (now >= nextReport) {
				report();
				nextReport += reportPeriod;
				continue;
			}
			channel.drainTo(hour);
			try {
				// never sleep past the report boundary
				Thread.sleep(Math.min(pollPeriod, nextReport - now));
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}
		}
		if (reports.size() < maxReports && (!hour.isEmpty() || !channel.isEmpty()))
			report();
	}
}
