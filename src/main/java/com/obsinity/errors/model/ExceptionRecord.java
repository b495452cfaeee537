package com.obsinity.errors.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One exception in an event. Chained causes become separate records, innermost cause first.
 */
public record ExceptionRecord(
	String type,
	String value,
	String module,
	Mechanism mechanism,
	Stacktrace stacktrace
) {

	public static ExceptionRecord from(Throwable t) {
		Class<?> c = t.getClass();
		return new ExceptionRecord(
			c.getSimpleName(),
			t.getMessage(),
			c.getPackageName(),
			null,
			t.getStackTrace().length == 0 ? null : Stacktrace.from(t.getStackTrace()));
	}

	/** Full cause chain of {@code error}, innermost cause first. */
	public static List<ExceptionRecord> chainOf(Throwable error) {
		List<ExceptionRecord> chain = new ArrayList<>();
		Throwable current = error;
		while (current != null && chain.size() < 32) {
			chain.add(0, from(current));
			current = (current.getCause() == current) ? null : current.getCause();
		}
		return chain;
	}

	public ExceptionRecord withMechanism(Mechanism m) {
		return new ExceptionRecord(type, value, module, m, stacktrace);
	}

	/** Shallow flattening with every key present; mechanism and stacktrace are {@code null} when absent. */
	public Map<String, Object> asMap() {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("type", type);
		m.put("value", value);
		m.put("module", module);
		m.put("mechanism", mechanism == null ? null : mechanism.asMap());
		m.put("stacktrace", stacktrace == null ? null : stacktrace.asMap());
		return m;
	}
}
