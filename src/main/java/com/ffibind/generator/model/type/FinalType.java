package com.ffibind.generator.model.type;

import com.ffibind.generator.exception.TypeConversionException;

import lombok.NonNull;
import lombok.Value;

/**
 * A fully processed type: how it crosses the FFI boundary, how it is exposed
 * on the surface, and which conversion links the two.
 *
 * The FFI type never changes once created. Conversions return a new instance
 * with a different surface type and descriptor, and leave the receiver as is.
 */
@Value
public class FinalType {

    /**
     * Type used in FFI wrapper signatures.
     */
    @NonNull
    BindingType ffiType;

    /**
     * Type used in the generated public API.
     */
    @NonNull
    BindingType surfaceType;

    @NonNull
    ConversionDescriptor conversion;

    public static FinalType identity(BindingType type) {
        return new FinalType(type, type, ConversionDescriptor.IDENTITY);
    }

    /**
     * Exposes a raw pointer as a borrow with the given constness.
     */
    public FinalType pointerToBorrow(boolean makeConst) {
        requireUnconverted("pointerToBorrow");
        IndirectionType pointer = requireRawPointerSurface("pointerToBorrow");
        BindingType borrow = IndirectionType.borrow(pointer.getPointee(), makeConst);
        return new FinalType(ffiType, borrow, ConversionDescriptor.REFERENCE_FROM_POINTER);
    }

    /**
     * Exposes a raw pointer as the value it points to.
     */
    public FinalType pointerToValue() {
        requireUnconverted("pointerToValue");
        IndirectionType pointer = requireRawPointerSurface("pointerToValue");
        return new FinalType(ffiType, pointer.getPointee(), ConversionDescriptor.VALUE_FROM_POINTER);
    }

    /**
     * Attaches a conversion chosen directly by the generation stage, such as an
     * owning handle or a flags wrapper.
     */
    public FinalType withConversion(@NonNull ConversionDescriptor descriptor, @NonNull BindingType newSurfaceType) {
        requireUnconverted("withConversion");
        if (descriptor == ConversionDescriptor.IDENTITY) {
            throw new TypeConversionException("IDENTITY is not a conversion: " + this);
        }
        if (descriptor.isFromPointer() && !ffiType.isRawPointer()) {
            throw new TypeConversionException(descriptor + " requires a raw pointer FFI type, got " + ffiType);
        }
        return new FinalType(ffiType, newSurfaceType, descriptor);
    }

    public boolean isConverted() {
        return conversion != ConversionDescriptor.IDENTITY;
    }

    private void requireUnconverted(String operation) {
        if (isConverted()) {
            throw new TypeConversionException(operation + ": conversion is already " + conversion + " for " + this);
        }
    }

    private IndirectionType requireRawPointerSurface(String operation) {
        if (surfaceType instanceof IndirectionType indirection
                && indirection.getKind() == IndirectionKind.RAW_POINTER) {
            return indirection;
        }
        throw new TypeConversionException(operation + ": not a raw pointer type: " + surfaceType);
    }
}
