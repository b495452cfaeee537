package com.obsinity.errors.transport;

import java.util.Map;

/** Fire-and-forget hand-off of one rendered payload; returns before delivery is attempted. */
public interface AsyncEventSender {
	void send(Map<String, Object> payload);
}
