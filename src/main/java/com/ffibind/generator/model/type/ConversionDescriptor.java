package com.ffibind.generator.model.type;

/**
 * How the surface-facing type of a value was derived from its FFI-facing type.
 */
public enum ConversionDescriptor {
    /**
     * Types are the same.
     */
    IDENTITY,

    /**
     * Borrow on the surface, raw pointer on the FFI side.
     */
    REFERENCE_FROM_POINTER,

    /**
     * Optional pointer wrapper on the surface, raw pointer that may be null on the FFI side.
     */
    OPTIONAL_WRAPPER_FROM_POINTER,

    /**
     * Plain value on the surface, raw pointer to it on the FFI side.
     */
    VALUE_FROM_POINTER,

    /**
     * Owning handle on the surface that deletes the native object when dropped.
     */
    OWNING_HANDLE_FROM_POINTER,

    /**
     * Adapter over a foreign smart pointer.
     */
    SMART_POINTER_FROM_POINTER,

    /**
     * Typed bit-flag set on the surface, plain integer on the FFI side.
     */
    INTEGER_FROM_FLAGS;

    /**
     * Returns true for descriptors whose FFI-side type is a raw pointer.
     */
    public boolean isFromPointer() {
        return switch (this) {
            case REFERENCE_FROM_POINTER, OPTIONAL_WRAPPER_FROM_POINTER, VALUE_FROM_POINTER,
                    OWNING_HANDLE_FROM_POINTER, SMART_POINTER_FROM_POINTER -> true;
            case IDENTITY, INTEGER_FROM_FLAGS -> false;
        };
    }
}
