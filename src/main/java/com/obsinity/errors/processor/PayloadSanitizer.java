package com.obsinity.errors.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes free-form values safe for the wire format.
 *
 * <p>Walks lists and maps recursively. Strings, numbers, booleans and {@code null} are kept as-is without asking the
 * encoder. Any other value is offered to the {@link PayloadEncoder}; when it is rejected it is replaced by a text
 * rendering of itself.
 *
 * <p>Containers whose contents did not change are returned as the very same instance, so a clean payload costs no
 * allocation. Changed containers are copied with only the changed slots replaced: lists keep their length and order,
 * maps keep their keys. A container that (directly or transitively) contains itself is replaced by its text form at
 * the point where it repeats.
 */
public class PayloadSanitizer {

	private static final Logger log = LoggerFactory.getLogger(PayloadSanitizer.class);

	private final PayloadEncoder encoder;

	public PayloadSanitizer(PayloadEncoder encoder) {
		this.encoder = Objects.requireNonNull(encoder, "encoder");
	}

	/** Sanitizes a free-form map; returns {@code map} itself when nothing had to change. */
	public <K> Map<K, Object> sanitizeMap(Map<K, Object> map) {
		if (map == null) return null;
		return castMap(walk(map, newPath()).value());
	}

	/** Sanitizes any value; returns {@code value} itself when nothing had to change. */
	public Object sanitize(Object value) {
		return walk(value, newPath()).value();
	}

	/** @param path containers currently being walked, by identity */
	private Sanitized walk(Object value, Set<Object> path) {
		if (value == null || value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
			return Sanitized.unchanged(value);
		}
		if (!(value instanceof List<?>) && !(value instanceof Map<?, ?>)) {
			return sanitizeOther(value);
		}
		if (!path.add(value)) {
			log.debug("Replacing self-referencing {} with its text form", value.getClass().getName());
			return Sanitized.changed(describeContainer(value));
		}
		try {
			return (value instanceof List<?> list) ? sanitizeElements(list, path) : sanitizeEntries((Map<?, ?>) value, path);
		} finally {
			path.remove(value);
		}
	}

	private Sanitized sanitizeElements(List<?> list, Set<Object> path) {
		List<Object> copy = null;
		for (int i = 0; i < list.size(); i++) {
			Sanitized s = walk(list.get(i), path);
			if (!s.changed()) continue;
			if (copy == null) copy = new ArrayList<>(list);
			copy.set(i, s.value());
		}
		return (copy == null) ? Sanitized.unchanged(list) : Sanitized.changed(copy);
	}

	private Sanitized sanitizeEntries(Map<?, ?> map, Set<Object> path) {
		Map<Object, Object> copy = null;
		for (Map.Entry<?, ?> e : map.entrySet()) {
			Sanitized s = walk(e.getValue(), path);
			if (!s.changed()) continue;
			if (copy == null) copy = new LinkedHashMap<>(map);
			copy.put(e.getKey(), s.value());
		}
		return (copy == null) ? Sanitized.unchanged(map) : Sanitized.changed(copy);
	}

	private Sanitized sanitizeOther(Object value) {
		try {
			encoder.encode(value);
			return Sanitized.unchanged(value);
		} catch (PayloadEncodingException | RuntimeException e) {
			log.debug("Replacing unencodable {} with its text form: {}", value.getClass().getName(), e.getMessage());
			return Sanitized.changed(describe(value));
		}
	}

	/** Best-effort, never-empty text form of {@code value}. Never throws. */
	static String describe(Object value) {
		String text;
		try {
			text = String.valueOf(value);
		} catch (RuntimeException e) {
			text = null;
		}
		if (text == null || text.isBlank()) {
			text = value.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(value));
		}
		return text;
	}

	// toString of a self-containing collection may itself recurse, so only the identity form is safe here.
	private static String describeContainer(Object value) {
		return value.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(value));
	}

	private static Set<Object> newPath() {
		return Collections.newSetFromMap(new IdentityHashMap<>());
	}

	@SuppressWarnings("unchecked")
	private static <K> Map<K, Object> castMap(Object value) {
		return (Map<K, Object>) value;
	}

	private record Sanitized(Object value, boolean changed) {
		static Sanitized unchanged(Object value) {
			return new Sanitized(value, false);
		}

		static Sanitized changed(Object value) {
			return new Sanitized(value, true);
		}
	}
}
