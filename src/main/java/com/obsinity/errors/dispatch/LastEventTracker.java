package com.obsinity.errors.dispatch;

import java.util.concurrent.atomic.AtomicReference;

import com.obsinity.errors.model.EventSource;

/**
 * Single-slot cell with the id of the last event handed to delivery, for correlation in UIs and log lines.
 *
 * <p>Last writer wins; concurrent submissions race without ordering guarantees. The value is advisory only.
 */
public class LastEventTracker {

	/** Id and origin of the last delivered event. */
	public record LastEvent(String eventId, EventSource source) {}

	private final AtomicReference<LastEvent> last = new AtomicReference<>();

	public void record(String eventId, EventSource source) {
		last.set(new LastEvent(eventId, source));
	}

	/** @return the last event, or {@code null} when nothing was sent yet */
	public LastEvent lastEvent() {
		return last.get();
	}

	public String lastEventId() {
		LastEvent e = last.get();
		return e == null ? null : e.eventId();
	}
}
