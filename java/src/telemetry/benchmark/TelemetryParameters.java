package telemetry.benchmark;

/**
 * Parameters of the temperature telemetry run.
 */
public class TelemetryParameters {

	public static final long ONE_HOUR_MS = 3600000;
	public static final long ONE_MINUTE_MS = 60000;
	/** Readings compared for the largest difference lie within this window */
	public static final long DIFFERENCE_WINDOW_MS = 10 * ONE_MINUTE_MS;

	public static int numSensors = 8,
		speedup = 250,
		hours = 3;
}
