package com.ffibind.generator.checks;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ffibind.generator.database.DatabaseConfig;
import com.ffibind.generator.database.FfiDatabaseItem;
import com.ffibind.generator.database.ItemDatabase;
import com.ffibind.generator.exception.GeneratorException;
import com.ffibind.generator.model.id.FfiItemId;
import com.ffibind.generator.model.target.Environment;

import lombok.NonNull;

/**
 * Runs a {@link WrapperCheck} for FFI items against every registered environment
 * and records the results in the items' ledgers.
 *
 * Environments of one item are checked in parallel. Results are recorded in
 * environment registration order once all checks of the item are done.
 */
public class CompatibilityCheckRunner {

    private static final Logger log = LoggerFactory.getLogger(CompatibilityCheckRunner.class);

    private final ItemDatabase database;
    private final WrapperCheck check;
    private final int threads;

    public CompatibilityCheckRunner(@NonNull ItemDatabase database, @NonNull WrapperCheck check,
                                    @NonNull DatabaseConfig config) {
        if (config.getCheckThreads() < 1) {
            throw new IllegalArgumentException("checkThreads must be >= 1. Got: " + config.getCheckThreads());
        }
        this.database = database;
        this.check = check;
        this.threads = config.getCheckThreads();
    }

    public CheckRunSummary runAll() {
        return run(database.ffiItems().stream().map(FfiDatabaseItem::getId).toList());
    }

    public CheckRunSummary run(@NonNull List<FfiItemId> itemIds) {
        List<Environment> environments = List.copyOf(database.environments());
        if (environments.isEmpty()) {
            log.warn("No environments registered, skipping checks of {} ffi items", itemIds.size());
            return CheckRunSummary.empty();
        }
        log.info("Checking {} ffi items in {} environments", itemIds.size(), environments.size());

        CheckRunSummary.CheckRunSummaryBuilder summary = CheckRunSummary.builder();
        int added = 0;
        int changed = 0;
        int unchanged = 0;

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, environments.size()));
        try {
            for (FfiItemId id : itemIds) {
                FfiDatabaseItem item = database.ffiItem(id);
                List<String> errors = checkItem(executor, item, environments);
                for (int i = 0; i < environments.size(); i++) {
                    Environment environment = environments.get(i);
                    String error = errors.get(i);
                    CheckRecordResult result = database.recordCheck(id, environment, error);
                    switch (result.getKind()) {
                        case ADDED -> added++;
                        case UNCHANGED -> unchanged++;
                        case CHANGED -> {
                            changed++;
                            if (error != null && result.getPreviousError().isEmpty()) {
                                log.warn("Regression: ffi item #{} ({}) now fails on {}: {}",
                                        id, item.path(), environment, error);
                                summary.regression(CheckRunSummary.Regression.of(id, environment, error));
                            }
                        }
                    }
                }
            }
        } finally {
            executor.shutdown();
        }

        CheckRunSummary result = summary
                .itemsChecked(itemIds.size())
                .added(added)
                .changed(changed)
                .unchanged(unchanged)
                .build();
        log.info("Checks recorded: {} added, {} changed, {} unchanged, {} regressions",
                added, changed, unchanged, result.getRegressions().size());
        return result;
    }

    private List<String> checkItem(ExecutorService executor, FfiDatabaseItem item, List<Environment> environments) {
        List<Callable<String>> tasks = new ArrayList<>();
        for (Environment environment : environments) {
            tasks.add(() -> runCheck(item, environment));
        }
        try {
            List<String> errors = new ArrayList<>();
            for (Future<String> future : executor.invokeAll(tasks)) {
                errors.add(future.get());
            }
            return errors;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneratorException("Interrupted while checking ffi item #" + item.getId(), e);
        } catch (ExecutionException e) {
            throw new GeneratorException("Check of ffi item #" + item.getId() + " failed unexpectedly", e.getCause());
        }
    }

    /**
     * Returns null on success, the failure message otherwise.
     */
    private String runCheck(FfiDatabaseItem item, Environment environment) {
        try {
            Optional<String> error = check.run(item.getItem(), environment);
            return error.orElse(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "check interrupted";
        } catch (Exception e) {
            log.debug("Check of ffi item #{} on {} threw", item.getId(), environment, e);
            return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        }
    }
}
