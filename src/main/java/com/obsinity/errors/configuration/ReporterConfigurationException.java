package com.obsinity.errors.configuration;

/**
 * Programmer error in the reporter configuration: malformed hook, unsupported completion mode, sample rate out of
 * range. Always raised synchronously and never converted into a {@link com.obsinity.errors.model.SendResult}.
 */
public final class ReporterConfigurationException extends IllegalArgumentException {
	private final String setting;

	public ReporterConfigurationException(String setting, String message) {
		super(message);
		this.setting = setting;
	}

	public ReporterConfigurationException(String setting, String message, Throwable cause) {
		super(message, cause);
		this.setting = setting;
	}

	/** Name of the offending setting, e.g. {@code before-send}. */
	public String setting() { return setting; }
}
