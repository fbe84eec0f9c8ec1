package com.ffibind.generator.model.ffi;

public interface FfiItemVisitor<R> {
    R visit(WrapperFunction function);
    R visit(SourceSlotWrapper slotWrapper);
}
