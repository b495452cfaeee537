package com.obsinity.errors.transport;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.errors.model.DeliveryFailure;
import com.obsinity.errors.model.SendResult;

/**
 * Default transport when no network transport is configured: encodes the batch and logs it.
 * - INFO: compact line with the event ids
 * - DEBUG: pretty JSON payload of the whole batch
 *
 * <p>Encoding failures are reported as {@link DeliveryFailure.Kind#INVALID_JSON}.
 */
public class LoggingTransport implements Transport {

	private static final Logger log = LoggerFactory.getLogger(LoggingTransport.class);

	private final ObjectMapper mapper;

	public LoggingTransport(ObjectMapper mapper) {
		// Use the Spring Boot mapper if provided; otherwise create a default.
		this.mapper = (mapper != null) ? mapper.copy() : new ObjectMapper().findAndRegisterModules();
	}

	@Override
	public SendResult post(List<Map<String, Object>> payloads, int retries) {
		if (payloads == null || payloads.isEmpty()) {
			return SendResult.failed(DeliveryFailure.requestFailure("empty batch"));
		}
		final String json;
		try {
			json = mapper.writeValueAsString(payloads);
		} catch (JsonProcessingException e) {
			return SendResult.failed(DeliveryFailure.invalidJson(e));
		}

		String eventId = String.valueOf(payloads.get(0).get("event_id"));
		log.info("obsinity error-event batch size={} eventId={} bytes={} retries={}",
			payloads.size(), eventId, json.length(), retries);
		if (log.isDebugEnabled()) {
			log.debug("error-event payload:\n{}", pretty(payloads, json));
		}
		return SendResult.accepted(eventId);
	}

	private String pretty(List<Map<String, Object>> payloads, String compact) {
		try {
			return mapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(payloads);
		} catch (JsonProcessingException e) {
			// Fallback to the compact form if pretty printing fails
			return compact;
		}
	}
}
