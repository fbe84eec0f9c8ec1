package com.ffibind.generator.model.surface;

import com.ffibind.generator.model.path.ItemPath;

/**
 * An entity of the generated target-language API.
 *
 * Every item except the package root lives below an existing parent item.
 * Implementations are value types; structurally equal items are duplicates.
 */
public interface SurfaceItem {

    <R> R accept(SurfaceItemVisitor<R> visitor);

    ItemPath path();

    default boolean isPackageRoot() {
        return false;
    }

    default boolean isChildOf(ItemPath parent) {
        return path().isChildOf(parent);
    }

    default String describe() {
        return accept(SurfaceItemDescriber.INSTANCE);
    }
}
