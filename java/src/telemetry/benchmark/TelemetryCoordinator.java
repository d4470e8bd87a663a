package telemetry.benchmark;

import java.util.List;

import telemetry.lockfree.ReadingChannel;

/**
 * Runs the temperature sensors and the report thread for a number of
 * scaled hours. Sensors push onto a shared {@link ReadingChannel} and
 * never wait on the reporter.
 */
public class TelemetryCoordinator {

	private final int numSensors;
	private final long minute;
	private final long hour;
	private final long window;

	private final ReadingChannel channel = new ReadingChannel();
	private SensorLoop[] sensorLoops;
	private ReportLoop reportLoop;

	public TelemetryCoordinator(int numSensors, int speedup) {
		if (numSensors < 1)
			throw new IllegalArgumentException("At least one sensor is needed: " + numSensors);
		if (speedup < 1 || speedup > TelemetryParameters.ONE_MINUTE_MS)
			throw new IllegalArgumentException("Speedup out of range: " + speedup);
		this.numSensors = numSensors;
		this.minute = TelemetryParameters.ONE_MINUTE_MS / speedup;
		this.hour = TelemetryParameters.ONE_HOUR_MS / speedup;
		this.window = TelemetryParameters.DIFFERENCE_WINDOW_MS / speedup;
	}

	/**
	 * Runs sensors and reporter for the given number of scaled hours,
	 * then stops and joins every thread. The reporter ends by itself
	 * after its last hourly report.
	 *
	 * @return the reports generated, one per elapsed hour
	 */
	public List<HourlyReport> run(int hours) throws InterruptedException {
		if (hours < 1)
			throw new IllegalArgumentException("At least one hour is needed: " + hours);
		sensorLoops = new SensorLoop[numSensors];
		Thread[] sensors = new Thread[numSensors];
		for (short i = 0; i < numSensors; i++) {
			sensorLoops[i] = new SensorLoop(i, channel, minute);
			sensors[i] = new Thread(sensorLoops[i], "sensor #" + i);
		}
		reportLoop = new ReportLoop(channel, minute, hour, window, hours);
		Thread reporter = new Thread(reportLoop, "reporter");

		for (Thread sensor : sensors)
			sensor.start();
		reporter.start();
		System.out.println("The sensor threads have been created and are pushing recordings onto the queue");
		try {
			reporter.join();
		} finally {
			for (SensorLoop loop : sensorLoops)
				loop.stopThread();
			reportLoop.stopThread();
			for (Thread sensor : sensors)
				sensor.join();
			reporter.join();
		}
		return reportLoop.getReports();
	}

	public long getNumReadings() {
		long n = 0;
		if (sensorLoops != null)
			for (SensorLoop loop : sensorLoops)
				n += loop.numReadings;
		return n;
	}

	public ReadingChannel getChannel() {
		return channel;
	}

	public static void main(String[] args) throws InterruptedException {
		parseCommandLineParameters(args);
		System.out.println("Telemetry parameters" + "\n" + "--------------------"
				+ "\n" + "  Sensors:                 \t" + TelemetryParameters.numSensors
				+ "\n" + "  Speedup:                 \t" + TelemetryParameters.speedup
				+ "\n" + "  Hours:                   \t" + TelemetryParameters.hours);
		TelemetryCoordinator coordinator = new TelemetryCoordinator(
				TelemetryParameters.numSensors, TelemetryParameters.speedup);
		List<HourlyReport> reports = coordinator.run(TelemetryParameters.hours);
		System.out.println("  Readings taken:           \t" + coordinator.getNumReadings());
		System.out.println("  Reports generated:        \t" + reports.size());
	}

	static void parseCommandLineParameters(String[] args) {
		int argNumber = 0;
		while (argNumber < args.length) {
			String currentArg = args[argNumber++];
			try {
				if (currentArg.equals("--help") || currentArg.equals("-h")) {
					System.err.println("Usage:\n"
							+ "java telemetry.benchmark.TelemetryCoordinator [options]\n\n"
							+ "Options:\n"
							+ "\t-s sensors -- set the number of sensors (default: " + TelemetryParameters.numSensors + ")\n"
							+ "\t-x speedup -- set the clock speedup factor (default: " + TelemetryParameters.speedup + ")\n"
							+ "\t-H hours   -- set the number of hours to report (default: " + TelemetryParameters.hours + ")");
					System.exit(0);
				}
				String optionValue = args[argNumber++];
				if (currentArg.equals("--sensors") || currentArg.equals("-s"))
					TelemetryParameters.numSensors = Integer.parseInt(optionValue);
				else if (currentArg.equals("--speedup") || currentArg.equals("-x"))
					TelemetryParameters.speedup = Integer.parseInt(optionValue);
				else if (currentArg.equals("--hours") || currentArg.equals("-H"))
					TelemetryParameters.hours = Integer.parseInt(optionValue);
				else
					System.err.println("Unknown option: " + currentArg + ". Ignoring...");
			} catch (IndexOutOfBoundsException e) {
				System.err.println("Missing value after option: " + currentArg + ". Ignoring...");
			} catch (NumberFormatException e) {
				System.err.println("Number expected after option:  " + currentArg + ". Ignoring...");
			}
		}
	}
}
