package com.ffibind.generator.database;

import java.util.List;

import com.ffibind.generator.checks.CheckEntry;
import com.ffibind.generator.model.ffi.FfiItem;
import com.ffibind.generator.model.id.FfiItemId;
import com.ffibind.generator.model.target.Environment;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Persistable state of an {@link ItemDatabase}. Written and read by the
 * persistence layer; the database itself does no I/O.
 */
@Value
@Builder(toBuilder = true)
public class DatabaseSnapshot {

    @NonNull
    String packageName;

    @NonNull
    String packageVersion;

    @NonNull
    @Singular
    List<NativeDatabaseItem> nativeItems;

    @NonNull
    @Singular
    List<FfiEntry> ffiItems;

    @NonNull
    @Singular
    List<SurfaceDatabaseItem> surfaceItems;

    @NonNull
    @Singular
    List<Environment> environments;

    int nextNativeId;
    int nextFfiId;
    int nextSurfaceId;

    /**
     * Detached copy of an {@link FfiDatabaseItem}.
     */
    @Value(staticConstructor = "of")
    public static class FfiEntry {

        @NonNull
        FfiItemId id;

        @NonNull
        FfiItem item;

        @NonNull
        List<CheckEntry> checks;

        boolean surfaceProcessed;
    }
}
