package com.ffibind.generator.database;

import com.ffibind.generator.model.id.SurfaceItemId;
import com.ffibind.generator.model.path.ItemPath;
import com.ffibind.generator.model.surface.SurfaceItem;

import lombok.NonNull;
import lombok.Value;

@Value
public class SurfaceDatabaseItem {

    @NonNull
    SurfaceItemId id;

    @NonNull
    SurfaceItem item;

    public ItemPath path() {
        return item.path();
    }
}
