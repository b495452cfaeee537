package com.obsinity.errors.model;

/**
 * Origin tag of an {@link ErrorEvent}.
 *
 * <ul>
 *   <li>{@link #USER}: captured explicitly by application code.
 *   <li>{@link #LOGGER}: produced by the logging integration. Delivery failures for these events are never logged,
 *       otherwise the failure line would itself be reported as a new event.
 * </ul>
 */
public enum EventSource {
	USER,
	LOGGER
}
