package com.ffibind.generator.model.target;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * One configuration an FFI item is validated under: a platform plus,
 * optionally, a version of the native library.
 */
@Value(staticConstructor = "of")
public class Environment {

    @NonNull
    PlatformTarget target;

    @Getter(AccessLevel.NONE)
    String libraryVersion;

    public static Environment of(PlatformTarget target) {
        return of(target, null);
    }

    public Optional<String> getLibraryVersion() {
        return Optional.ofNullable(libraryVersion);
    }

    public String shortText() {
        return libraryVersion == null ? target.shortText() : target.shortText() + " (" + libraryVersion + ")";
    }

    @Override
    public String toString() {
        return shortText();
    }
}
