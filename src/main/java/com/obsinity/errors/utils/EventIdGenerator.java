package com.obsinity.errors.utils;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.UUID;

/** UUIDv7-based event ids, rendered as 32 lowercase hex chars (the ingest wire form). */
public final class EventIdGenerator {
	private static final SecureRandom RNG = new SecureRandom();

	public static UUID generate() {
		long millis = Instant.now().toEpochMilli();             // 48 bits
		long msb = (millis & 0xFFFFFFFFFFFFL) << 16;            // timestamp << 16
		msb |= 0x7000L;                                         // version 7 in bits 12..15
		msb |= (RNG.nextLong() & 0x0FFFL);                      // 12-bit rand_a

		long lsb = RNG.nextLong();
		lsb = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L; // set variant 10xx

		return new UUID(msb, lsb);
	}

	/** New event id: 32 hex chars, no dashes. */
	public static String newEventId() {
		return hex(generate());
	}

	public static String hex(UUID u) {
		return String.format("%016x%016x", u.getMostSignificantBits(), u.getLeastSignificantBits());
	}

	/** True when {@code id} looks like an event id produced by {@link #newEventId()}. */
	public static boolean isEventId(String id) {
		if (id == null || id.length() != 32) return false;
		for (int i = 0; i < id.length(); i++) {
			char c = id.charAt(i);
			if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) return false;
		}
		return true;
	}

	private EventIdGenerator() {}
}
