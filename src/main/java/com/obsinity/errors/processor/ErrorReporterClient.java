package com.obsinity.errors.processor;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.errors.configuration.ErrorReporterProperties;
import com.obsinity.errors.dispatch.CompletionMode;
import com.obsinity.errors.dispatch.EventDispatcher;
import com.obsinity.errors.dispatch.LastEventTracker;
import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.SendResult;
import com.obsinity.errors.receivers.HookInvoker;

/**
 * Runs the submission pipeline for one event:
 * sample → before-send hook → render and dispatch → after-send hook.
 *
 * <p>Unsampled and excluded events stop before rendering: no transport call and no after-send hook. Configuration
 * errors are thrown; delivery errors come back as {@link SendResult.Status#FAILED}.
 */
@RequiredArgsConstructor
public class ErrorReporterClient {

	private static final Logger log = LoggerFactory.getLogger(ErrorReporterClient.class);

	private final ErrorReporterProperties properties;
	private final EventSampler sampler;
	private final HookInvoker hooks;
	private final EventRenderer renderer;
	private final EventDispatcher dispatcher;
	private final LastEventTracker lastEvent;

	public SendResult sendEvent(ErrorEvent event) {
		return sendEvent(event, SendOptions.defaults());
	}

	public SendResult sendEvent(ErrorEvent event, SendOptions options) {
		Objects.requireNonNull(event, "event");
		final SendOptions opts = (options != null) ? options : SendOptions.defaults();

		final CompletionMode mode = opts.completionModeOr(properties);
		final int retries = opts.requestRetriesOr(properties);

		if (!sampler.sample(opts.sampleRateOr(properties))) {
			log.debug("error-event unsampled eventId={}", event.eventId());
			return SendResult.unsampled();
		}

		final Optional<ErrorEvent> kept = hooks.beforeSend(event);
		if (kept.isEmpty()) {
			log.debug("error-event excluded by before-send hook eventId={}", event.eventId());
			return SendResult.excluded();
		}

		final ErrorEvent toSend = kept.get();
		final SendResult result = dispatcher.dispatch(toSend, mode, retries);
		hooks.afterSend(toSend, result);
		return result;
	}

	/** The payload {@link #sendEvent} would deliver for {@code event}, without sampling, hooks or delivery. */
	public Map<String, Object> renderEvent(ErrorEvent event) {
		return renderer.render(Objects.requireNonNull(event, "event"));
	}

	/** Id of the last event handed to delivery, or {@code null}. */
	public String lastEventId() {
		return lastEvent.lastEventId();
	}
}
