package com.obsinity.errors.processor;

/**
 * Serialization helper of the target wire format. The sanitizer uses it as the "is this natively serializable"
 * predicate; transports use it to produce the request body.
 */
public interface PayloadEncoder {

	/**
	 * @return the encoded form of {@code value}
	 * @throws PayloadEncodingException when the format cannot represent {@code value}
	 */
	String encode(Object value) throws PayloadEncodingException;
}
