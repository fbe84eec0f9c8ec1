package com.ffibind.generator.model.ffi;

import com.ffibind.generator.model.path.ItemPath;

/**
 * A wrapper entity whose signature can cross the language boundary.
 *
 * Implementations are value types; structurally equal items are duplicates.
 */
public interface FfiItem {

    <R> R accept(FfiItemVisitor<R> visitor);

    ItemPath path();

    /**
     * Returns true if the item needs helper source emitted in addition to its declaration.
     */
    boolean isSourceItem();

    default String describe() {
        return accept(FfiItemDescriber.INSTANCE);
    }
}
