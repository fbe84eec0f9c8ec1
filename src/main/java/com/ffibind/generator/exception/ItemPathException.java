package com.ffibind.generator.exception;

import com.ffibind.generator.model.path.ItemPath;

/**
 * Thrown when a surface item refers to an ancestor path that is not stored yet.
 */
public class ItemPathException extends GeneratorException {

	private static final long serialVersionUID = 1L;
	private final ItemPath path;

	public ItemPathException(String message, ItemPath path) {
		super(message + ": " + path);
		this.path = path;
	}

	public ItemPath getPath() {
		return path;
	}
}
