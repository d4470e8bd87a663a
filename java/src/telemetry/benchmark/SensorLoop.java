package telemetry.benchmark;

import java.util.Random;

import telemetry.abstractions.TemperatureReading;
import telemetry.lockfree.ReadingChannel;

/**
 * The loop executed by each temperature sensor: take a reading, push it
 * onto the channel and wait for the next (scaled) minute.
 */
public class SensorLoop implements Runnable {

	private final ReadingChannel channel;
	private final long period;
	/** The number of the current sensor */
	protected final short mySensorNum;
	/** The stop flag, indicating whether the loop is over */
	protected volatile boolean stop = false;

	/** The counter of pushed readings */
	public volatile long numReadings = 0;

	Random rand = new Random();

	public SensorLoop(short mySensorNum, ReadingChannel channel, long period) {
		this.mySensorNum = mySensorNum;
		this.channel = channel;
		this.period = period;
	}

	public void stopThread() {
		stop = true;
	}

	TemperatureReading read() {
		int range = TemperatureReading.MAX_TEMPERATURE - TemperatureReading.MIN_TEMPERATURE + 1;
		return new TemperatureReading(mySensorNum,
				TemperatureReading.MIN_TEMPERATURE + rand.nextInt(range),
				System.currentTimeMillis());
	}

	public void run() {
		while (!stop) {
			channel.push(read());
			numReadings++;
			try {
				Thread.sleep(period);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
		}
	}
}
