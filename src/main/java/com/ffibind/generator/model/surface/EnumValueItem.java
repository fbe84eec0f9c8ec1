package com.ffibind.generator.model.surface;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

@Value(staticConstructor = "of")
public class EnumValueItem implements SurfaceItem {

    @NonNull
    ItemPath path;

    long value;

    @Override
    public <R> R accept(SurfaceItemVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ItemPath path() {
        return path;
    }
}
