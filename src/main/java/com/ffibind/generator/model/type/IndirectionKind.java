package com.ffibind.generator.model.type;

/**
 * Kind of a pointer-like type.
 */
public enum IndirectionKind {
    /**
     * Raw pointer, mutable or const. Using it requires unsafe code.
     */
    RAW_POINTER,

    /**
     * Borrowed reference, optionally with a named lifetime.
     */
    BORROW
}
