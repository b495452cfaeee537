package com.obsinity.errors.dispatch;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.errors.configuration.ReporterConfigurationException;
import com.obsinity.errors.model.DeliveryFailure;
import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.SendResult;
import com.obsinity.errors.processor.EventRenderer;
import com.obsinity.errors.transport.AsyncEventSender;
import com.obsinity.errors.transport.Transport;

/** Renders an accepted event and hands it to delivery according to the {@link CompletionMode}. */
public class EventDispatcher {

	private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

	private final EventRenderer renderer;
	private final Transport transport;
	private final AsyncEventSender asyncSender;
	private final LastEventTracker lastEvent;
	private final SendFailureLogger failureLogger;

	public EventDispatcher(
		EventRenderer renderer,
		Transport transport,
		AsyncEventSender asyncSender,
		LastEventTracker lastEvent,
		SendFailureLogger failureLogger) {
		this.renderer = Objects.requireNonNull(renderer, "renderer");
		this.transport = Objects.requireNonNull(transport, "transport");
		this.asyncSender = Objects.requireNonNull(asyncSender, "asyncSender");
		this.lastEvent = Objects.requireNonNull(lastEvent, "lastEvent");
		this.failureLogger = Objects.requireNonNull(failureLogger, "failureLogger");
	}

	/**
	 * @throws ReporterConfigurationException for {@link CompletionMode#ASYNC}, before anything is rendered or sent
	 */
	public SendResult dispatch(ErrorEvent event, CompletionMode mode, int retries) {
		return switch (Objects.requireNonNull(mode, "mode")) {
			case SYNC -> sendSync(event, retries);
			case NONE -> sendNoWait(event);
			case ASYNC -> throw new ReporterConfigurationException("completion-mode",
				"the ASYNC completion mode is not supported anymore. Submit the event from your own executor or "
					+ "thread with completion mode SYNC instead; the effect is the same.");
		};
	}

	private SendResult sendSync(ErrorEvent event, int retries) {
		Map<String, Object> payload = renderer.render(event);
		SendResult result = post(payload, retries);
		if (result.isAccepted()) {
			lastEvent.record(event.eventId(), event.source());
		}
		log.debug("error-event sync dispatch eventId={} result={}", event.eventId(), result);
		failureLogger.logResult(result, event);
		return result;
	}

	/** Transport faults are delivery failures, never exceptions for the caller. */
	private SendResult post(Map<String, Object> payload, int retries) {
		final SendResult result;
		try {
			result = transport.post(List.of(payload), retries);
		} catch (RuntimeException e) {
			return SendResult.failed(DeliveryFailure.requestFailure(e));
		}
		if (result == null) {
			return SendResult.failed(DeliveryFailure.requestFailure(
				"transport " + transport.getClass().getName() + " returned no result"));
		}
		return result;
	}

	private SendResult sendNoWait(ErrorEvent event) {
		asyncSender.send(renderer.render(event));
		lastEvent.record(event.eventId(), event.source());
		log.debug("error-event handed off eventId={}", event.eventId());
		return SendResult.acceptedWithoutConfirmation();
	}
}
