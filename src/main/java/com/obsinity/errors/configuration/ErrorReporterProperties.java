package com.obsinity.errors.configuration;

import org.slf4j.event.Level;
import org.springframework.boot.context.properties.ConfigurationProperties;

import com.obsinity.errors.dispatch.CompletionMode;

/**
 * Defaults for every submission, bound from {@code obsinity.errors.*}. Each value can be overridden per call with
 * {@link com.obsinity.errors.processor.SendOptions}.
 *
 * <pre>
 * obsinity.errors.sample-rate=0.25
 * obsinity.errors.completion-mode=none
 * obsinity.errors.log-level=error
 * obsinity.errors.before-send=com.acme.ErrorHooks#scrub
 * </pre>
 */
@ConfigurationProperties(prefix = "obsinity.errors")
public class ErrorReporterProperties {

	public static final int DEFAULT_REQUEST_RETRIES = 4;

	/** Probability in [0,1] that an event is kept. */
	private double sampleRate = 1.0;

	private CompletionMode completionMode = CompletionMode.SYNC;

	/** Passed through to the transport; this library never retries itself. */
	private int requestRetries = DEFAULT_REQUEST_RETRIES;

	/** Level used for delivery-failure log lines. */
	private Level logLevel = Level.WARN;

	/** {@code fully.qualified.Class#method} taking the event; ignored when a BeforeSendHook bean exists. */
	private String beforeSend;

	/** {@code fully.qualified.Class#method} taking (event, result); ignored when an AfterSendHook bean exists. */
	private String afterSend;

	public double getSampleRate() { return sampleRate; }
	public void setSampleRate(double sampleRate) { this.sampleRate = sampleRate; }

	public CompletionMode getCompletionMode() { return completionMode; }
	public void setCompletionMode(CompletionMode completionMode) { this.completionMode = completionMode; }

	public int getRequestRetries() { return requestRetries; }
	public void setRequestRetries(int requestRetries) { this.requestRetries = requestRetries; }

	public Level getLogLevel() { return logLevel; }
	public void setLogLevel(Level logLevel) { this.logLevel = logLevel; }

	public String getBeforeSend() { return beforeSend; }
	public void setBeforeSend(String beforeSend) { this.beforeSend = beforeSend; }

	public String getAfterSend() { return afterSend; }
	public void setAfterSend(String afterSend) { this.afterSend = afterSend; }
}
