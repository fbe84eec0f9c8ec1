package com.ffibind.generator.model.id;

import lombok.Value;

@Value(staticConstructor = "of")
public class SurfaceItemId implements Comparable<SurfaceItemId> {

    int value;

    @Override
    public int compareTo(SurfaceItemId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
