package com.ffibind.generator.model.type;

/**
 * Detects raw pointers anywhere inside a type.
 */
public final class UnsafeTypeVisitor implements BindingTypeVisitor<Boolean> {

    public static final UnsafeTypeVisitor INSTANCE = new UnsafeTypeVisitor();

    private UnsafeTypeVisitor() {
    }

    @Override
    public Boolean visit(UnitType unit) {
        return false;
    }

    @Override
    public Boolean visit(NamedType named) {
        return named.getTypeArguments().stream().anyMatch(argument -> argument.accept(this));
    }

    @Override
    public Boolean visit(FunctionSignatureType signature) {
        return signature.getReturnType().accept(this)
                || signature.getParameterTypes().stream().anyMatch(parameter -> parameter.accept(this));
    }

    @Override
    public Boolean visit(IndirectionType indirection) {
        return indirection.getKind() == IndirectionKind.RAW_POINTER || indirection.getPointee().accept(this);
    }
}
