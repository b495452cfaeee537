package com.obsinity.errors.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Identifies the SDK that produced an event. */
public record SdkInfo(String name, String version, List<String> integrations) {

	public SdkInfo {
		integrations = (integrations == null) ? null : Collections.unmodifiableList(new ArrayList<>(integrations));
	}

	public static final String NAME = "obsinity.errors.java";

	public Map<String, Object> asMap() {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("name", name);
		m.put("version", version);
		m.put("integrations", integrations);
		return m;
	}
}
