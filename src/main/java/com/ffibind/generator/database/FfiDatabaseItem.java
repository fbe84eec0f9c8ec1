package com.ffibind.generator.database;

import com.ffibind.generator.checks.CompatibilityLedger;
import com.ffibind.generator.model.ffi.FfiItem;
import com.ffibind.generator.model.id.FfiItemId;
import com.ffibind.generator.model.path.ItemPath;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;

/**
 * A stored FFI item with its check results.
 */
@Getter
@ToString
public class FfiDatabaseItem {

    private final FfiItemId id;
    private final FfiItem item;
    private final CompatibilityLedger checks;

    /**
     * Set once surface generation has consumed this item.
     */
    @Setter(AccessLevel.PACKAGE)
    private boolean surfaceProcessed;

    FfiDatabaseItem(@NonNull FfiItemId id, @NonNull FfiItem item, @NonNull CompatibilityLedger checks,
                    boolean surfaceProcessed) {
        this.id = id;
        this.item = item;
        this.checks = checks;
        this.surfaceProcessed = surfaceProcessed;
    }

    public ItemPath path() {
        return item.path();
    }

    public boolean isSourceItem() {
        return item.isSourceItem();
    }

    /**
     * Returns true if the item passed in at least one environment and has not been consumed yet.
     */
    public boolean isReadyForSurface() {
        return !surfaceProcessed && checks.anyPassed();
    }
}
