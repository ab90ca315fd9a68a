package org.javai.dygram.config;

/**
 * Configuration could not be read or holds an invalid value.
 */
public class DygramConfigException extends RuntimeException {

	public DygramConfigException(String message) {
		super(message);
	}

	public DygramConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
