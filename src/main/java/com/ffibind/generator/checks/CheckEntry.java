package com.ffibind.generator.checks;

import java.util.Optional;

import com.ffibind.generator.model.target.Environment;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of checking one FFI item in one environment. No error means the check passed.
 */
@Value(staticConstructor = "of")
public class CheckEntry {

    @NonNull
    Environment environment;

    @Getter(AccessLevel.NONE)
    String error;

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isPassed() {
        return error == null;
    }
}
