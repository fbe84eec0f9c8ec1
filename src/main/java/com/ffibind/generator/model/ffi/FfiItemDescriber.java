package com.ffibind.generator.model.ffi;

import java.util.stream.Collectors;

final class FfiItemDescriber implements FfiItemVisitor<String> {

    static final FfiItemDescriber INSTANCE = new FfiItemDescriber();

    private FfiItemDescriber() {
    }

    @Override
    public String visit(WrapperFunction function) {
        String arguments = function.getArguments().stream()
                .map(argument -> argument.getName() + ": " + argument.getType())
                .collect(Collectors.joining(", ", "(", ")"));
        return "wrapper " + function.getPath() + arguments + " -> " + function.getReturnType()
                + " for " + function.getNativePath();
    }

    @Override
    public String visit(SourceSlotWrapper slotWrapper) {
        return "slot wrapper " + slotWrapper.getClassPath() + " " + slotWrapper.getReceiverSignature();
    }
}
