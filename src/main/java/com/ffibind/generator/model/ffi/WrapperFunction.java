package com.ffibind.generator.model.ffi;

import java.util.List;

import com.ffibind.generator.model.path.ItemPath;
import com.ffibind.generator.model.type.BindingType;
import com.ffibind.generator.model.type.UnitType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A plain wrapper function. Only its signature is declared on the FFI side.
 */
@Value
@Builder(toBuilder = true)
public class WrapperFunction implements FfiItem {

    /**
     * Name of the exported wrapper symbol.
     */
    @NonNull
    ItemPath path;

    /**
     * Path of the native function being wrapped.
     */
    @NonNull
    ItemPath nativePath;

    @NonNull
    @Singular
    List<FfiArgument> arguments;

    @NonNull
    @Builder.Default
    BindingType returnType = UnitType.INSTANCE;

    @Override
    public <R> R accept(FfiItemVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ItemPath path() {
        return path;
    }

    @Override
    public boolean isSourceItem() {
        return false;
    }

    /**
     * Returns true if any argument or the return type contains a raw pointer.
     */
    public boolean hasUnsafeSignature() {
        return returnType.isUnsafe() || arguments.stream().anyMatch(argument -> argument.getType().isUnsafe());
    }
}
