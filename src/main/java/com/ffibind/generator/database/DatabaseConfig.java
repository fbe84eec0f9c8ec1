package com.ffibind.generator.database;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for a binding database and the check stage working on it.
 */
@Value
@Builder(toBuilder = true)
public class DatabaseConfig {

    /**
     * Name of the generated package. Every surface path starts with it.
     */
    @NonNull
    String packageName;

    @NonNull
    @Builder.Default
    String packageVersion = ItemDatabase.INITIAL_VERSION;

    /**
     * Threads used to check one FFI item against its environments.
     */
    @Builder.Default
    int checkThreads = Runtime.getRuntime().availableProcessors();
}
