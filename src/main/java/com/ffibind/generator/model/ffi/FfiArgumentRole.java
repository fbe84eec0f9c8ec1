package com.ffibind.generator.model.ffi;

/**
 * What an FFI wrapper argument stands for in the wrapped native function.
 */
public enum FfiArgumentRole {
    /**
     * The object a method is called on.
     */
    RECEIVER,

    ARGUMENT,

    /**
     * Output pointer the wrapper writes the native return value into.
     */
    RETURN_VALUE
}
