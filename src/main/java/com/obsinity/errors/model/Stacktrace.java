package com.obsinity.errors.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Frames of an exception, outermost call first (ingest convention). */
public record Stacktrace(List<StackFrame> frames) {

	public Stacktrace {
		frames = (frames == null) ? List.of() : List.copyOf(frames);
	}

	/** JVM traces are innermost-first; the ingest expects the reverse. */
	public static Stacktrace from(StackTraceElement[] elements) {
		List<StackFrame> frames = new ArrayList<>(elements.length);
		for (int i = elements.length - 1; i >= 0; i--) {
			frames.add(StackFrame.from(elements[i]));
		}
		return new Stacktrace(frames);
	}

	/** Renders as {@code {"frames": [frame maps]}}. */
	public Map<String, Object> asMap() {
		List<Map<String, Object>> rendered = new ArrayList<>(frames.size());
		for (StackFrame f : frames) {
			rendered.add(f.asMap());
		}
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("frames", rendered);
		return m;
	}
}
