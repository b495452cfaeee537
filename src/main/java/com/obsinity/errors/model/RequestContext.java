package com.obsinity.errors.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP request the error happened in. Any component may be {@code null}; null components are dropped from the
 * rendered payload.
 */
public record RequestContext(
	String method,
	String url,
	String queryString,
	String data,
	String cookies,
	Map<String, String> headers,
	Map<String, String> env
) {

	public RequestContext {
		headers = readOnly(headers);
		env = readOnly(env);
	}

	public static RequestContext of(String method, String url) {
		return new RequestContext(method, url, null, null, null, null, null);
	}

	public Map<String, Object> asMap() {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("method", method);
		m.put("url", url);
		m.put("query_string", queryString);
		m.put("data", data);
		m.put("cookies", cookies);
		m.put("headers", headers);
		m.put("env", env);
		return m;
	}

	private static Map<String, String> readOnly(Map<String, String> map) {
		return (map == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
	}
}
