package com.ffibind.generator.model.surface;

public interface SurfaceItemVisitor<R> {
    R visit(PackageRootItem packageRoot);
    R visit(ModuleItem module);
    R visit(StructItem struct);
    R visit(EnumValueItem enumValue);
    R visit(FunctionItem function);
}
