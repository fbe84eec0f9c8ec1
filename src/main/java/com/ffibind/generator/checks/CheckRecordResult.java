package com.ffibind.generator.checks;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of {@link CompatibilityLedger#record}.
 */
@Value
public class CheckRecordResult {

    public enum Kind {
        /**
         * First result for the environment.
         */
        ADDED,
        /**
         * The environment had a different result, now replaced.
         */
        CHANGED,
        UNCHANGED
    }

    private static final CheckRecordResult ADDED = new CheckRecordResult(Kind.ADDED, null);
    private static final CheckRecordResult UNCHANGED = new CheckRecordResult(Kind.UNCHANGED, null);

    @NonNull
    Kind kind;

    /**
     * Error recorded before a change; null if the environment used to pass.
     */
    @Getter(AccessLevel.NONE)
    String previousError;

    public static CheckRecordResult added() {
        return ADDED;
    }

    public static CheckRecordResult unchanged() {
        return UNCHANGED;
    }

    public static CheckRecordResult changed(String previousError) {
        return new CheckRecordResult(Kind.CHANGED, previousError);
    }

    public Optional<String> getPreviousError() {
        return Optional.ofNullable(previousError);
    }

    public boolean isChanged() {
        return kind == Kind.CHANGED;
    }
}
