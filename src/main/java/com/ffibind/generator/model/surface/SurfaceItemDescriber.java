package com.ffibind.generator.model.surface;

import java.util.stream.Collectors;

final class SurfaceItemDescriber implements SurfaceItemVisitor<String> {

    static final SurfaceItemDescriber INSTANCE = new SurfaceItemDescriber();

    private SurfaceItemDescriber() {
    }

    @Override
    public String visit(PackageRootItem packageRoot) {
        return "package root " + packageRoot.getPath();
    }

    @Override
    public String visit(ModuleItem module) {
        return "module " + module.getPath() + " (" + module.getKind().name().toLowerCase() + ")";
    }

    @Override
    public String visit(StructItem struct) {
        return "struct " + struct.getPath() + " for " + struct.getNativeTypePath();
    }

    @Override
    public String visit(EnumValueItem enumValue) {
        return "enum value " + enumValue.getPath() + " = " + enumValue.getValue();
    }

    @Override
    public String visit(FunctionItem function) {
        String arguments = function.getArguments().stream()
                .map(argument -> argument.getName() + ": " + argument.getType().getSurfaceType())
                .collect(Collectors.joining(", ", "(", ")"));
        return (function.isUnsafe() ? "unsafe fn " : "fn ") + function.getPath() + arguments
                + " -> " + function.getReturnType().getSurfaceType() + " via ffi item #" + function.getFfiItem();
    }
}
