package com.ffibind.generator.model.declaration;

/**
 * Visitor over the closed set of native declaration kinds.
 */
public interface DeclarationVisitor<R> {
    R visit(NamespaceDeclaration namespace);
    R visit(TypeDeclaration type);
    R visit(EnumValueDeclaration enumValue);
    R visit(FunctionDeclaration function);
    R visit(ClassFieldDeclaration field);
    R visit(ClassBaseDeclaration base);
    R visit(SignalArgumentsDeclaration signalArguments);
}
