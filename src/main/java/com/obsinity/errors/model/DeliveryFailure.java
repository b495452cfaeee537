package com.obsinity.errors.model;

import java.util.Objects;

/**
 * Why a blocking delivery failed.
 *
 * @param kind   failure class
 * @param detail human-readable detail (may be {@code null})
 * @param cause  captured fault; for {@link Kind#REQUEST_FAILURE} a non-null cause means the stack trace was captured
 */
public record DeliveryFailure(Kind kind, String detail, Throwable cause) {

	public enum Kind {
		/** The configured destination (DSN) is malformed or missing. */
		INVALID_DSN,
		/** The payload batch could not be encoded. */
		INVALID_JSON,
		/** The request failed after the transport's own retries. */
		REQUEST_FAILURE
	}

	public DeliveryFailure {
		Objects.requireNonNull(kind, "kind");
	}

	public static DeliveryFailure invalidDsn() {
		return new DeliveryFailure(Kind.INVALID_DSN, null, null);
	}

	public static DeliveryFailure invalidJson(Throwable cause) {
		return new DeliveryFailure(Kind.INVALID_JSON, cause == null ? null : cause.getMessage(), cause);
	}

	/** Request failure with a captured fault (exception plus its stack trace). */
	public static DeliveryFailure requestFailure(Throwable cause) {
		return new DeliveryFailure(Kind.REQUEST_FAILURE, cause.getMessage(), cause);
	}

	/** Request failure known only by a description, e.g. {@code "HTTP 503"}. */
	public static DeliveryFailure requestFailure(String detail) {
		return new DeliveryFailure(Kind.REQUEST_FAILURE, detail, null);
	}
}
