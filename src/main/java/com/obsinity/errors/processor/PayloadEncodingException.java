package com.obsinity.errors.processor;

/** A value could not be encoded by the {@link PayloadEncoder}. */
public class PayloadEncodingException extends Exception {
	public PayloadEncodingException(String message, Throwable cause) {
		super(message, cause);
	}
}
