package com.ffibind.generator.model.type;

import java.util.Optional;

import com.ffibind.generator.exception.TypeConversionException;
import com.ffibind.generator.model.path.ItemPath;

/**
 * A type as seen on one side of the FFI boundary.
 *
 * Shapes: {@link UnitType}, {@link NamedType}, {@link FunctionSignatureType}
 * and {@link IndirectionType}. Consumers dispatch through {@link BindingTypeVisitor}.
 */
public interface BindingType {

    <R> R accept(BindingTypeVisitor<R> visitor);

    /**
     * Returns an identifier-safe description of this type for name disambiguation.
     * Parts of the path shared with {@code context} are dropped.
     */
    default String caption(ItemPath context) {
        return accept(new TypeCaptionVisitor(context));
    }

    /**
     * Returns true if this type is, or contains at any depth, a raw pointer.
     * Functions taking or returning such a type must be assumed unsafe.
     */
    default boolean isUnsafe() {
        return accept(UnsafeTypeVisitor.INSTANCE);
    }

    default boolean isRawPointer() {
        return this instanceof IndirectionType indirection && indirection.getKind() == IndirectionKind.RAW_POINTER;
    }

    default boolean isBorrow() {
        return this instanceof IndirectionType indirection && indirection.getKind() == IndirectionKind.BORROW;
    }

    /**
     * Returns a copy with the lifetime set, if this is a borrow; otherwise returns this type.
     */
    default BindingType withLifetime(String lifetime) {
        if (this instanceof IndirectionType indirection && indirection.getKind() == IndirectionKind.BORROW) {
            return IndirectionType.borrow(indirection.getPointee(), indirection.isConstant(), lifetime);
        }
        return this;
    }

    default Optional<String> lifetime() {
        if (this instanceof IndirectionType indirection) {
            return Optional.ofNullable(indirection.getLifetime());
        }
        return Optional.empty();
    }

    /**
     * Constness of the outermost indirection.
     */
    default boolean isConst() {
        return asIndirection().isConstant();
    }

    default BindingType withConst(boolean constant) {
        IndirectionType indirection = asIndirection();
        return new IndirectionType(indirection.getKind(), indirection.getLifetime(), constant, indirection.getPointee());
    }

    default BindingType pointee() {
        return asIndirection().getPointee();
    }

    default IndirectionType asIndirection() {
        if (this instanceof IndirectionType indirection) {
            return indirection;
        }
        throw new TypeConversionException("not a pointer-like type: " + this);
    }

    default NamedType asNamed() {
        if (this instanceof NamedType named) {
            return named;
        }
        throw new TypeConversionException("expected named type, got " + this);
    }
}
