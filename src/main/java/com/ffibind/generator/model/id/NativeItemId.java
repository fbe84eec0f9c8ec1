package com.ffibind.generator.model.id;

import lombok.Value;

/**
 * Identifier of a native declaration. Allocated in increasing order and never reused.
 */
@Value(staticConstructor = "of")
public class NativeItemId implements Comparable<NativeItemId> {

    int value;

    @Override
    public int compareTo(NativeItemId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
