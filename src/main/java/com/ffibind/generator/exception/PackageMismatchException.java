package com.ffibind.generator.exception;

/**
 * Thrown when an item's package segment differs from the package owning the database.
 */
public class PackageMismatchException extends GeneratorException {

	private static final long serialVersionUID = 1L;
	private final String expectedPackage;
	private final String actualPackage;

	public PackageMismatchException(String expectedPackage, String actualPackage, Object item) {
		super("can't add item with package '" + actualPackage + "' to package '" + expectedPackage + "': " + item);
		this.expectedPackage = expectedPackage;
		this.actualPackage = actualPackage;
	}

	public String getExpectedPackage() {
		return expectedPackage;
	}

	public String getActualPackage() {
		return actualPackage;
	}
}
