package com.obsinity.errors.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** JSON encoding through Jackson. Beans with no serializable properties are rejected rather than written as {@code {}}. */
public class JacksonPayloadEncoder implements PayloadEncoder {

	private final ObjectMapper mapper;

	public JacksonPayloadEncoder(ObjectMapper mapper) {
		// Use the application's mapper if provided; otherwise create a default.
		ObjectMapper base = (mapper != null) ? mapper.copy() : new ObjectMapper().findAndRegisterModules();
		this.mapper = base.enable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
			.disable(SerializationFeature.INDENT_OUTPUT);
	}

	@Override
	public String encode(Object value) throws PayloadEncodingException {
		try {
			return mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new PayloadEncodingException("cannot encode " + typeName(value) + " as JSON", e);
		}
	}

	private static String typeName(Object value) {
		return value == null ? "null" : value.getClass().getName();
	}
}
