package com.ffibind.generator.exception;

/**
 * Base type for item-level failures raised by the binding database and the type algebra.
 * A failure aborts only the single insertion or conversion that raised it.
 */
public class GeneratorException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public GeneratorException(String message) {
		super(message);
	}

	public GeneratorException(String message, Throwable cause) {
		super(message, cause);
	}
}
