package com.obsinity.errors.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** How an exception was captured, e.g. {@code ("logger", true)} or {@code ("uncaught", false)}. */
public record Mechanism(String type, Boolean handled) {

	public Map<String, Object> asMap() {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("type", type);
		m.put("handled", handled);
		return m;
	}
}
