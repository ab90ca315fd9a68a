package org.javai.dygram.json;

/**
 * JSON could not be read as, or written from, a machine.
 */
public class MachineJsonException extends RuntimeException {

	public MachineJsonException(String message) {
		super(message);
	}

	public MachineJsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
