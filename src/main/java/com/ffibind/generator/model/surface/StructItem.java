package com.ffibind.generator.model.surface;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

/**
 * Surface type wrapping a native class or enum.
 */
@Value(staticConstructor = "of")
public class StructItem implements SurfaceItem {

    @NonNull
    ItemPath path;

    @NonNull
    ItemPath nativeTypePath;

    /**
     * True if values are stored inline; false if only handled through pointers.
     */
    boolean valueType;

    @Override
    public <R> R accept(SurfaceItemVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ItemPath path() {
        return path;
    }
}
