package com.ffibind.generator.model.surface;

import java.util.List;

import com.ffibind.generator.model.id.FfiItemId;
import com.ffibind.generator.model.path.ItemPath;
import com.ffibind.generator.model.type.FinalType;
import com.ffibind.generator.model.type.UnitType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A generated function calling an FFI wrapper.
 */
@Value
@Builder(toBuilder = true)
public class FunctionItem implements SurfaceItem {

    @NonNull
    ItemPath path;

    /**
     * The wrapper this function calls.
     */
    @NonNull
    FfiItemId ffiItem;

    @NonNull
    @Singular
    List<SurfaceArgument> arguments;

    @NonNull
    @Builder.Default
    FinalType returnType = FinalType.identity(UnitType.INSTANCE);

    @Override
    public <R> R accept(SurfaceItemVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ItemPath path() {
        return path;
    }

    /**
     * Returns true if the public signature exposes a raw pointer anywhere.
     */
    public boolean isUnsafe() {
        return returnType.getSurfaceType().isUnsafe()
                || arguments.stream().anyMatch(argument -> argument.getType().getSurfaceType().isUnsafe());
    }
}
