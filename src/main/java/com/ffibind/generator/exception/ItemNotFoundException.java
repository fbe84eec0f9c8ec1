package com.ffibind.generator.exception;

/**
 * Thrown when a lookup by identifier finds nothing.
 */
public class ItemNotFoundException extends GeneratorException {

	private static final long serialVersionUID = 1L;

	public ItemNotFoundException(String message) {
		super(message);
	}
}
