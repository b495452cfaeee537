package com.obsinity.errors.receivers;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.errors.configuration.ReporterConfigurationException;
import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.SendResult;

/**
 * Holds the two user hook slots and calls them with a uniform convention. Both slots are optional; an empty slot
 * behaves as identity (before-send) or no-op (after-send).
 */
public class HookInvoker {

	private static final Logger log = LoggerFactory.getLogger(HookInvoker.class);

	public static final String BEFORE_SEND = "before-send";
	public static final String AFTER_SEND = "after-send";

	private final HookCallable beforeSend;
	private final HookCallable afterSend;

	/**
	 * Validates both hooks up front.
	 *
	 * @throws ReporterConfigurationException when either value has an unsupported shape or arity
	 */
	public HookInvoker(Object beforeSend, Object afterSend) {
		this.beforeSend = HookCallable.resolve(BEFORE_SEND, beforeSend, 1);
		this.afterSend = HookCallable.resolve(AFTER_SEND, afterSend, 2);
		log.debug("Error hooks: before-send={} after-send={}", describe(this.beforeSend), describe(this.afterSend));
	}

	public static HookInvoker none() {
		return new HookInvoker(null, null);
	}

	/**
	 * @return the event to continue with, or empty when the hook dropped it ({@code null} or {@code false} result)
	 * @throws ReporterConfigurationException when the hook returns something that is neither an event nor a drop
	 */
	public Optional<ErrorEvent> beforeSend(ErrorEvent event) {
		if (beforeSend == null) return Optional.of(event);

		Object result = beforeSend.invoke(event);
		if (result == null || Boolean.FALSE.equals(result)) {
			return Optional.empty();
		}
		if (result instanceof ErrorEvent e) {
			return Optional.of(e);
		}
		throw new ReporterConfigurationException(BEFORE_SEND,
			BEFORE_SEND + " hook " + beforeSend + " must return an ErrorEvent, null or false; got "
				+ result.getClass().getName());
	}

	/** Result is ignored; exceptions propagate. */
	public void afterSend(ErrorEvent event, SendResult result) {
		if (afterSend != null) {
			afterSend.invoke(event, result);
		}
	}

	private static String describe(HookCallable h) {
		return h == null ? "-" : h.toString();
	}
}
