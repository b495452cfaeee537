package com.obsinity.errors.transport;

import java.util.List;
import java.util.Map;

import com.obsinity.errors.model.SendResult;

/**
 * Delivers rendered payloads. Implementations own encoding, the network call and any retry/backoff.
 */
public interface Transport {

	/**
	 * Posts a batch of rendered events and blocks until the outcome is known.
	 *
	 * @param payloads rendered, sanitized event payloads
	 * @param retries  retry budget, interpreted by the implementation
	 * @return {@link SendResult#accepted(String)} with the acknowledged event id, or {@link SendResult#failed} with the
	 *         reason. Never {@code UNSAMPLED} or {@code EXCLUDED}; never throws for delivery problems.
	 */
	SendResult post(List<Map<String, Object>> payloads, int retries);
}
