package com.obsinity.errors.receivers;

import com.obsinity.errors.model.ErrorEvent;

/**
 * Inspects, rewrites or drops an event after sampling and before it is rendered.
 *
 * <p>Return the event (or a copy built with {@link ErrorEvent#toBuilder()}) to continue, or {@code null} to drop it.
 * Runs synchronously on the submitting thread; keep it fast.
 *
 * <pre>{@code
 * @Bean
 * BeforeSendHook dropHealthChecks() {
 *     return event -> "/health".equals(event.transaction()) ? null : event;
 * }
 * }</pre>
 */
@FunctionalInterface
public interface BeforeSendHook {
	ErrorEvent beforeSend(ErrorEvent event);
}
