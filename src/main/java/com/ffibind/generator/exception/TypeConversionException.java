package com.ffibind.generator.exception;

/**
 * Thrown when a type conversion is applied to a type of the wrong shape, or applied twice.
 */
public class TypeConversionException extends GeneratorException {

	private static final long serialVersionUID = 1L;

	public TypeConversionException(String message) {
		super(message);
	}
}
