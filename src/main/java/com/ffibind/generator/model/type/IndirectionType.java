package com.ffibind.generator.model.type;

import lombok.NonNull;
import lombok.Value;

/**
 * A pointer or reference to another type.
 */
@Value
public class IndirectionType implements BindingType {

    @NonNull
    IndirectionKind kind;

    /**
     * Named lifetime of a borrow. Always null for raw pointers.
     */
    String lifetime;

    boolean constant;

    @NonNull
    BindingType pointee;

    public IndirectionType(@NonNull IndirectionKind kind, String lifetime, boolean constant,
                           @NonNull BindingType pointee) {
        if (kind == IndirectionKind.RAW_POINTER && lifetime != null) {
            throw new IllegalArgumentException("raw pointer can't carry a lifetime: " + lifetime);
        }
        this.kind = kind;
        this.lifetime = lifetime;
        this.constant = constant;
        this.pointee = pointee;
    }

    public static IndirectionType rawPointer(BindingType pointee, boolean constant) {
        return new IndirectionType(IndirectionKind.RAW_POINTER, null, constant, pointee);
    }

    public static IndirectionType borrow(BindingType pointee, boolean constant) {
        return new IndirectionType(IndirectionKind.BORROW, null, constant, pointee);
    }

    public static IndirectionType borrow(BindingType pointee, boolean constant, String lifetime) {
        return new IndirectionType(IndirectionKind.BORROW, lifetime, constant, pointee);
    }

    @Override
    public <R> R accept(BindingTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        if (kind == IndirectionKind.RAW_POINTER) {
            return (constant ? "*const " : "*mut ") + pointee;
        }
        String lifetimeText = lifetime != null ? "'" + lifetime + " " : "";
        return "&" + lifetimeText + (constant ? "" : "mut ") + pointee;
    }
}
