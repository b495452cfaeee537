package com.obsinity.errors.model;

import java.util.Objects;

/**
 * Outcome of one submission. Exactly one per call to
 * {@link com.obsinity.errors.processor.ErrorReporterClient#sendEvent}.
 *
 * <p>{@link Status#UNSAMPLED} and {@link Status#EXCLUDED} are ordinary control-flow results, not errors.
 * {@link Status#FAILED} carries the {@link DeliveryFailure} reported by the transport.
 */
public final class SendResult {

	public enum Status {
		/** Handed to the transport; {@link #eventId()} is the acknowledged id, or {@code ""} for fire-and-forget. */
		ACCEPTED,
		/** Dropped by sampling. */
		UNSAMPLED,
		/** Dropped by the before-send hook. */
		EXCLUDED,
		/** The transport could not deliver. */
		FAILED
	}

	private static final SendResult UNSAMPLED = new SendResult(Status.UNSAMPLED, null, null);
	private static final SendResult EXCLUDED = new SendResult(Status.EXCLUDED, null, null);

	private final Status status;
	private final String eventId;           // ACCEPTED only
	private final DeliveryFailure failure;  // FAILED only

	private SendResult(Status status, String eventId, DeliveryFailure failure) {
		this.status = Objects.requireNonNull(status, "status");
		this.eventId = eventId;
		this.failure = failure;
	}

	public static SendResult accepted(String eventId) {
		return new SendResult(Status.ACCEPTED, Objects.requireNonNull(eventId, "eventId"), null);
	}

	/** Fire-and-forget acceptance: nothing has been confirmed, so the id is empty. */
	public static SendResult acceptedWithoutConfirmation() {
		return new SendResult(Status.ACCEPTED, "", null);
	}

	public static SendResult unsampled() {
		return UNSAMPLED;
	}

	public static SendResult excluded() {
		return EXCLUDED;
	}

	public static SendResult failed(DeliveryFailure failure) {
		return new SendResult(Status.FAILED, null, Objects.requireNonNull(failure, "failure"));
	}

	public Status status() { return status; }
	public String eventId() { return eventId; }
	public DeliveryFailure failure() { return failure; }

	public boolean isAccepted() {
		return status == Status.ACCEPTED;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SendResult other)) return false;
		return status == other.status && Objects.equals(eventId, other.eventId) && Objects.equals(failure, other.failure);
	}

	@Override
	public int hashCode() {
		return Objects.hash(status, eventId, failure);
	}

	@Override
	public String toString() {
		return switch (status) {
			case ACCEPTED -> "ACCEPTED(" + eventId + ")";
			case FAILED -> "FAILED(" + failure + ")";
			default -> status.name();
		};
	}
}
