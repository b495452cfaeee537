package com.obsinity.errors.processor;

import com.obsinity.errors.configuration.ErrorReporterProperties;
import com.obsinity.errors.dispatch.CompletionMode;

/**
 * Per-call overrides for {@link ErrorReporterClient#sendEvent}. A {@code null} component falls back to
 * {@link ErrorReporterProperties}, read at submission time.
 */
public record SendOptions(Double sampleRate, CompletionMode completionMode, Integer requestRetries) {

	private static final SendOptions DEFAULTS = new SendOptions(null, null, null);

	public static SendOptions defaults() {
		return DEFAULTS;
	}

	public SendOptions withSampleRate(double rate) {
		return new SendOptions(rate, completionMode, requestRetries);
	}

	public SendOptions withCompletionMode(CompletionMode mode) {
		return new SendOptions(sampleRate, mode, requestRetries);
	}

	public SendOptions withRequestRetries(int retries) {
		return new SendOptions(sampleRate, completionMode, retries);
	}

	double sampleRateOr(ErrorReporterProperties p) {
		return sampleRate != null ? sampleRate : p.getSampleRate();
	}

	CompletionMode completionModeOr(ErrorReporterProperties p) {
		return completionMode != null ? completionMode : p.getCompletionMode();
	}

	int requestRetriesOr(ErrorReporterProperties p) {
		return requestRetries != null ? requestRetries : p.getRequestRetries();
	}
}
