package com.obsinity.errors.processor;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import com.obsinity.errors.configuration.ReporterConfigurationException;

/** Per-submission sampling decision. */
public class EventSampler {

	private final DoubleSupplier random;

	public EventSampler() {
		this(() -> ThreadLocalRandom.current().nextDouble());
	}

	/** @param random uniform source in [0,1); tests inject a fixed sequence */
	public EventSampler(DoubleSupplier random) {
		this.random = random;
	}

	/**
	 * @param sampleRate probability in [0,1] of keeping the event
	 * @return true to keep. Rates 0 and 1 never consume a random draw.
	 */
	public boolean sample(double sampleRate) {
		if (Double.isNaN(sampleRate) || sampleRate < 0.0 || sampleRate > 1.0) {
			throw new ReporterConfigurationException(
				"sample-rate", "sample rate must be a number in [0, 1], got " + sampleRate);
		}
		if (sampleRate == 1.0) return true;
		if (sampleRate == 0.0) return false;
		return random.getAsDouble() < sampleRate;
	}
}
