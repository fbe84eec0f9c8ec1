package com.ffibind.generator.model.surface;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

@Value(staticConstructor = "of")
public class ModuleItem implements SurfaceItem {

    public enum Kind {
        /**
         * Mirrors a native namespace.
         */
        NAMESPACE,
        /**
         * Holds the associated items of a native class.
         */
        TYPE_SCOPE,
        /**
         * Holds raw FFI declarations.
         */
        FFI
    }

    @NonNull
    ItemPath path;

    @NonNull
    Kind kind;

    @Override
    public <R> R accept(SurfaceItemVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ItemPath path() {
        return path;
    }
}
