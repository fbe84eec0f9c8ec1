package com.ffibind.generator.model.surface;

import com.ffibind.generator.model.path.ItemPath;

import lombok.NonNull;
import lombok.Value;

/**
 * Root of the generated package. Its path is the single package-name segment.
 */
@Value(staticConstructor = "of")
public class PackageRootItem implements SurfaceItem {

    @NonNull
    ItemPath path;

    public static PackageRootItem forPackage(String packageName) {
        return of(ItemPath.of(packageName));
    }

    @Override
    public <R> R accept(SurfaceItemVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ItemPath path() {
        return path;
    }

    @Override
    public boolean isPackageRoot() {
        return true;
    }
}
