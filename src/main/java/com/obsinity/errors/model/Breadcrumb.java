package com.obsinity.errors.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A trail entry recorded before the error happened (HTTP call, DB query, user action...).
 *
 * <p>{@code data} is free-form and is sanitized when the owning event is rendered.
 */
public record Breadcrumb(
	String type,
	String category,
	String message,
	String level,
	Instant timestamp,
	Map<String, Object> data
) {

	public Breadcrumb {
		data = (data == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
	}

	public static Breadcrumb of(String category, String message) {
		return new Breadcrumb(null, category, message, null, Instant.now(), null);
	}

	/** Shallow wire-form flattening; absent fields stay as {@code null} entries. */
	public Map<String, Object> asMap() {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("type", type);
		m.put("category", category);
		m.put("message", message);
		m.put("level", level);
		m.put("timestamp", timestamp == null ? null : timestamp.toString());
		m.put("data", data);
		return m;
	}
}
