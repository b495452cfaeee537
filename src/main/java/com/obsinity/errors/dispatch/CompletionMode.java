package com.obsinity.errors.dispatch;

/**
 * How a submission waits for delivery.
 *
 * <ul>
 *   <li>{@link #SYNC}: render, post to the transport and wait for its answer. The result carries the acknowledged
 *       event id or the {@link com.obsinity.errors.model.DeliveryFailure}.
 *   <li>{@link #NONE}: render, hand the payload to the async sender and return at once with an empty event id.
 *       Delivery failures are only visible in the sender's logs.
 *   <li>{@link #ASYNC}: retired. Always rejected with a configuration error; submit from your own executor with
 *       {@link #SYNC} instead.
 * </ul>
 */
public enum CompletionMode {
	SYNC,

	NONE,

	/** Retired; see class docs. */
	ASYNC
}
