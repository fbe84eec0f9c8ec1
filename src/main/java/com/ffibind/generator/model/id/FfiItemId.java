package com.ffibind.generator.model.id;

import lombok.Value;

/**
 * Identifier of an FFI wrapper item. Separate namespace from {@link NativeItemId}.
 */
@Value(staticConstructor = "of")
public class FfiItemId implements Comparable<FfiItemId> {

    int value;

    @Override
    public int compareTo(FfiItemId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
