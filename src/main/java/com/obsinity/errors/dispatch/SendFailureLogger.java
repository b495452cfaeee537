package com.obsinity.errors.dispatch;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import com.obsinity.errors.model.DeliveryFailure;
import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.EventSource;
import com.obsinity.errors.model.SendResult;

/**
 * Writes one diagnostic line per failed blocking delivery, at a configurable level.
 *
 * <p>Events from the logging integration ({@link EventSource#LOGGER}) are never logged: the line would be captured
 * and reported again.
 */
public class SendFailureLogger {

	static final String PREFIX = "Failed to send error event. ";

	private final Level level;
	private final Logger log;

	public SendFailureLogger(Level level) {
		this(level, LoggerFactory.getLogger(SendFailureLogger.class));
	}

	SendFailureLogger(Level level, Logger log) {
		this.level = Objects.requireNonNull(level, "level");
		this.log = log;
	}

	public void logResult(SendResult result, ErrorEvent event) {
		if (event.source() == EventSource.LOGGER) return;
		if (result.status() != SendResult.Status.FAILED) return;

		DeliveryFailure failure = result.failure();
		String line = describe(failure);
		// A captured fault is logged with its stack trace.
		Throwable trace = (failure.kind() == DeliveryFailure.Kind.REQUEST_FAILURE) ? failure.cause() : null;
		write(PREFIX + line, trace);
	}

	/** Human-readable classification of {@code failure}. */
	public static String describe(DeliveryFailure failure) {
		return switch (failure.kind()) {
			case INVALID_DSN -> "Cannot send error event because of invalid DSN";
			case INVALID_JSON -> "Unable to encode JSON error event - " + detail(failure);
			case REQUEST_FAILURE -> failure.cause() != null
				? "Request to error ingest failed with " + failure.cause()
				: "Error in HTTP request to error ingest - " + detail(failure);
		};
	}

	private static String detail(DeliveryFailure failure) {
		if (failure.cause() != null) return String.valueOf(failure.cause());
		return failure.detail() == null ? "unknown error" : failure.detail();
	}

	private void write(String message, Throwable trace) {
		switch (level) {
			case ERROR -> log.error(message, trace);
			case WARN -> log.warn(message, trace);
			case INFO -> log.info(message, trace);
			case DEBUG -> log.debug(message, trace);
			case TRACE -> log.trace(message, trace);
		}
	}
}
