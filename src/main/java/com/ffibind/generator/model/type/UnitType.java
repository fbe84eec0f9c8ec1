package com.ffibind.generator.model.type;

/**
 * No value crosses the boundary. Used where the native side returns nothing.
 */
public final class UnitType implements BindingType {

    public static final UnitType INSTANCE = new UnitType();

    private UnitType() {
    }

    @Override
    public <R> R accept(BindingTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "()";
    }
}
