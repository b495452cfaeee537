package com.obsinity.errors.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** A single frame in a stack trace. */
public record StackFrame(
	String filename,
	String function,
	String module,
	Integer lineno,
	Boolean inApp
) {

	public static StackFrame from(StackTraceElement element) {
		Integer lineno = element.getLineNumber() > 0 ? element.getLineNumber() : null;
		return new StackFrame(
			element.getFileName(),
			element.getMethodName(),
			element.getClassName(),
			lineno,
			isInApp(element.getClassName()));
	}

	private static boolean isInApp(String className) {
		return !className.startsWith("java.")
			&& !className.startsWith("javax.")
			&& !className.startsWith("jakarta.")
			&& !className.startsWith("sun.")
			&& !className.startsWith("com.sun.")
			&& !className.startsWith("jdk.")
			&& !className.startsWith("org.springframework.")
			&& !className.startsWith("com.obsinity.errors.");
	}

	public Map<String, Object> asMap() {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("filename", filename);
		m.put("function", function);
		m.put("module", module);
		m.put("lineno", lineno);
		m.put("in_app", inApp);
		return m;
	}
}
