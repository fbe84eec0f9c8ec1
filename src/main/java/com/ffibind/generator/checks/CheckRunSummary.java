package com.ffibind.generator.checks;

import java.util.List;

import com.ffibind.generator.model.id.FfiItemId;
import com.ffibind.generator.model.target.Environment;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Aggregated results of one {@link CompatibilityCheckRunner} run.
 */
@Value
@Builder(toBuilder = true)
public class CheckRunSummary {

    int itemsChecked;
    int added;
    int changed;
    int unchanged;

    /**
     * Checks that passed before this run and fail now.
     */
    @NonNull
    @Singular
    List<Regression> regressions;

    public static CheckRunSummary empty() {
        return CheckRunSummary.builder().build();
    }

    public boolean hasRegressions() {
        return !regressions.isEmpty();
    }

    @Value(staticConstructor = "of")
    public static class Regression {

        @NonNull
        FfiItemId ffiItem;

        @NonNull
        Environment environment;

        @NonNull
        String error;
    }
}
