package com.obsinity.errors.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import com.obsinity.errors.model.Breadcrumb;
import com.obsinity.errors.model.ErrorEvent;
import com.obsinity.errors.model.ExceptionRecord;

/**
 * Turns an {@link ErrorEvent} into the plain map handed to the transport.
 *
 * <ul>
 *   <li>Only present fields are written; absent ones are omitted, never written as {@code null}.
 *   <li>{@code source} and {@code originalException} are never written.
 *   <li>{@code message} is cut to {@value #MAX_MESSAGE_LENGTH} characters, the ingest's field limit.
 *   <li>Breadcrumbs, sdk and request are flattened to maps; request entries with a {@code null} value are dropped.
 *   <li>{@code extra}, {@code user}, {@code tags} and each breadcrumb's {@code data} go through the
 *       {@link PayloadSanitizer}.
 *   <li>Exceptions are flattened to maps, stacktraces to {@code {"frames": [...]}}.
 * </ul>
 */
public class EventRenderer {

	public static final int MAX_MESSAGE_LENGTH = 8_192;

	private final PayloadSanitizer sanitizer;

	public EventRenderer(PayloadSanitizer sanitizer) {
		this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
	}

	/** @return an unmodifiable, serialization-ready map */
	public Map<String, Object> render(ErrorEvent event) {
		Map<String, Object> out = new LinkedHashMap<>();
		out.put("event_id", event.eventId());
		out.put("timestamp", event.timestamp().toString());
		putIfPresent(out, "level", event.level(), Function.identity());
		putIfPresent(out, "platform", event.platform(), Function.identity());
		putIfPresent(out, "logger", event.logger(), Function.identity());
		putIfPresent(out, "server_name", event.serverName(), Function.identity());
		putIfPresent(out, "environment", event.environment(), Function.identity());
		putIfPresent(out, "release", event.release(), Function.identity());
		putIfPresent(out, "transaction", event.transaction(), Function.identity());
		putIfPresent(out, "message", event.message(), EventRenderer::truncateMessage);
		putIfPresent(out, "fingerprint", event.fingerprint(), Function.identity());
		putIfPresent(out, "breadcrumbs", event.breadcrumbs(), this::renderBreadcrumbs);
		putIfPresent(out, "sdk", event.sdk(), sdk -> sdk.asMap());
		putIfPresent(out, "request", event.request(), request -> withoutNulls(request.asMap()));
		putIfPresent(out, "extra", event.extra(), sanitizer::sanitizeMap);
		putIfPresent(out, "user", event.user(), sanitizer::sanitizeMap);
		putIfPresent(out, "tags", event.tags(), sanitizer::sanitizeMap);
		putIfPresent(out, "exception", event.exception(), EventRenderer::renderExceptions);
		return Collections.unmodifiableMap(out);
	}

	/** Cuts to {@value #MAX_MESSAGE_LENGTH} code points; a surrogate pair is never split. */
	static String truncateMessage(String message) {
		if (message.length() <= MAX_MESSAGE_LENGTH) return message;
		if (message.codePointCount(0, message.length()) <= MAX_MESSAGE_LENGTH) return message;
		return message.substring(0, message.offsetByCodePoints(0, MAX_MESSAGE_LENGTH));
	}

	private List<Map<String, Object>> renderBreadcrumbs(List<Breadcrumb> breadcrumbs) {
		List<Map<String, Object>> rendered = new ArrayList<>(breadcrumbs.size());
		for (Breadcrumb b : breadcrumbs) {
			Map<String, Object> m = b.asMap();
			if (b.data() != null) {
				m.put("data", sanitizer.sanitizeMap(b.data()));
			}
			rendered.add(m);
		}
		return rendered;
	}

	private static List<Map<String, Object>> renderExceptions(List<ExceptionRecord> exceptions) {
		List<Map<String, Object>> rendered = new ArrayList<>(exceptions.size());
		for (ExceptionRecord e : exceptions) {
			rendered.add(e.asMap());
		}
		return rendered;
	}

	private static Map<String, Object> withoutNulls(Map<String, Object> map) {
		map.values().removeIf(Objects::isNull);
		return map;
	}

	private static <T> void putIfPresent(Map<String, Object> out, String key, T value, Function<T, ?> render) {
		if (value != null) {
			out.put(key, render.apply(value));
		}
	}
}
