package com.obsinity.errors.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;

import com.obsinity.errors.utils.EventIdGenerator;

/**
 * A fully captured error/message event, ready for the submission pipeline.
 *
 * <p>Everything except {@link #eventId()} is optional. {@link #source()} and {@link #originalException()} are
 * internal bookkeeping and never cross the transport boundary; every other field is rendered by
 * {@link com.obsinity.errors.processor.EventRenderer}.
 *
 * <p>Instances are immutable. Before-send hooks derive a changed copy via {@link #toBuilder()}:
 *
 * <pre>{@code
 * BeforeSendHook scrub = event -> event.toBuilder().user(null).build();
 * }</pre>
 */
public final class ErrorEvent {

	/* ── payload ─────────────────────────────────────────────────── */
	private final String eventId;
	private final Instant timestamp;
	private final String level;
	private final String platform;
	private final String logger;
	private final String serverName;
	private final String environment;
	private final String release;
	private final String transaction;
	private final String message;
	private final List<String> fingerprint;
	private final List<Breadcrumb> breadcrumbs;
	private final SdkInfo sdk;
	private final RequestContext request;
	private final Map<String, Object> extra;    // free-form
	private final Map<String, Object> tags;     // free-form
	private final Map<String, Object> user;     // free-form
	private final List<ExceptionRecord> exception;

	/* ── internal only ───────────────────────────────────────────── */
	private final EventSource source;
	private final Throwable originalException;

	@Builder(toBuilder = true)
	private ErrorEvent(
		String eventId,
		Instant timestamp,
		String level,
		String platform,
		String logger,
		String serverName,
		String environment,
		String release,
		String transaction,
		String message,
		List<String> fingerprint,
		List<Breadcrumb> breadcrumbs,
		SdkInfo sdk,
		RequestContext request,
		Map<String, Object> extra,
		Map<String, Object> tags,
		Map<String, Object> user,
		List<ExceptionRecord> exception,
		EventSource source,
		Throwable originalException
	) {
		this.eventId = (eventId == null || eventId.isBlank()) ? EventIdGenerator.newEventId() : eventId;
		this.timestamp = (timestamp != null) ? timestamp : Instant.now();
		this.level = level;
		this.platform = (platform != null) ? platform : "java";
		this.logger = logger;
		this.serverName = serverName;
		this.environment = environment;
		this.release = release;
		this.transaction = transaction;
		this.message = message;
		this.fingerprint = readOnly(fingerprint);
		this.breadcrumbs = readOnly(breadcrumbs);
		this.sdk = sdk;
		this.request = request;
		this.extra = readOnly(extra);
		this.tags = readOnly(tags);
		this.user = readOnly(user);
		this.exception = readOnly(exception);
		this.source = (source != null) ? source : EventSource.USER;
		this.originalException = originalException;
	}

	/** Event for {@code error} with its full cause chain as exception records. */
	public static ErrorEvent fromThrowable(Throwable error) {
		return builder()
			.level("error")
			.exception(ExceptionRecord.chainOf(error))
			.originalException(error)
			.build();
	}

	public static ErrorEvent fromMessage(String message) {
		return builder().level("info").message(message).build();
	}

	/* ========================= Accessors (record-like) ========================= */
	public String eventId() { return eventId; }
	public Instant timestamp() { return timestamp; }
	public String level() { return level; }
	public String platform() { return platform; }
	public String logger() { return logger; }
	public String serverName() { return serverName; }
	public String environment() { return environment; }
	public String release() { return release; }
	public String transaction() { return transaction; }
	public String message() { return message; }
	public List<String> fingerprint() { return fingerprint; }
	public List<Breadcrumb> breadcrumbs() { return breadcrumbs; }
	public SdkInfo sdk() { return sdk; }
	public RequestContext request() { return request; }
	public Map<String, Object> extra() { return extra; }
	public Map<String, Object> tags() { return tags; }
	public Map<String, Object> user() { return user; }
	public List<ExceptionRecord> exception() { return exception; }
	public EventSource source() { return source; }
	public Throwable originalException() { return originalException; }

	@Override
	public String toString() {
		return "ErrorEvent{eventId=" + eventId + ", level=" + level + ", source=" + source + "}";
	}

	private static <T> List<T> readOnly(List<T> list) {
		return (list == null) ? null : Collections.unmodifiableList(new ArrayList<>(list));
	}

	private static Map<String, Object> readOnly(Map<String, Object> map) {
		return (map == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
	}
}
