package com.ffibind.generator.model.declaration;

import java.util.stream.Collectors;

final class DeclarationDescriber implements DeclarationVisitor<String> {

    static final DeclarationDescriber INSTANCE = new DeclarationDescriber();

    private DeclarationDescriber() {
    }

    @Override
    public String visit(NamespaceDeclaration namespace) {
        return "namespace " + namespace.getPath();
    }

    @Override
    public String visit(TypeDeclaration type) {
        return type.getKind().name().toLowerCase() + " " + type.getPath();
    }

    @Override
    public String visit(EnumValueDeclaration enumValue) {
        return "enum value " + enumValue.getPath() + " = " + enumValue.getValue();
    }

    @Override
    public String visit(FunctionDeclaration function) {
        String arguments = function.getArguments().stream()
                .map(argument -> argument.getType() + " " + argument.getName())
                .collect(Collectors.joining(", ", "(", ")"));
        return (function.isStaticMethod() ? "static " : "")
                + function.getReturnType() + " " + function.getPath() + arguments
                + (function.isConstMethod() ? " const" : "");
    }

    @Override
    public String visit(ClassFieldDeclaration field) {
        return "field " + field.getFieldType() + " " + field.getPath();
    }

    @Override
    public String visit(ClassBaseDeclaration base) {
        return "class " + base.getDerivedClassPath() + " : " + (base.isVirtualBase() ? "virtual " : "")
                + base.getBaseClassPath();
    }

    @Override
    public String visit(SignalArgumentsDeclaration signalArguments) {
        return signalArguments.getArgumentTypes().stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", "signal arguments (", ")"));
    }
}
