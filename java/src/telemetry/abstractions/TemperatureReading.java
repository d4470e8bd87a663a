package telemetry.abstractions;

/**
 * One sensor sample: a temperature in Fahrenheit and the time it was
 * taken, in milliseconds.
 */
public final class TemperatureReading {

	public static final int MIN_TEMPERATURE = -100;
	public static final int MAX_TEMPERATURE = 70;

	private final int sensor;
	private final int temperature;
	private final long timestamp;

	public TemperatureReading(int sensor, int temperature, long timestamp) {
		if (temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)
			throw new IllegalArgumentException("Temperature out of range: " + temperature);
		this.sensor = sensor;
		this.temperature = temperature;
		this.timestamp = timestamp;
	}

	public int getSensor() {
		return sensor;
	}

	public int getTemperature() {
		return temperature;
	}

	public long getTimestamp() {
		return timestamp;
	}

	@Override
	public String toString() {
		return temperature + "F@" + timestamp + " (sensor " + sensor + ")";
	}
}
