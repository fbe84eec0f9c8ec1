package com.ffibind.generator.model.type;

/**
 * Visitor over the closed set of binding type shapes.
 * Adding a shape forces every implementation to handle it.
 */
public interface BindingTypeVisitor<R> {
    R visit(UnitType unit);
    R visit(NamedType named);
    R visit(FunctionSignatureType signature);
    R visit(IndirectionType indirection);
}
