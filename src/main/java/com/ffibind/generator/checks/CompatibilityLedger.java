package com.ffibind.generator.checks;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.ffibind.generator.model.target.Environment;

import lombok.NonNull;

/**
 * Per-environment check results of one FFI item, in recording order,
 * with at most one entry per environment.
 *
 * All methods synchronize on the ledger so that checks of one item running
 * in several threads can record into it.
 */
public class CompatibilityLedger {

    private final List<CheckEntry> entries = new ArrayList<>();

    public CompatibilityLedger() {
    }

    public CompatibilityLedger(@NonNull List<CheckEntry> entries) {
        for (CheckEntry entry : entries) {
            record(entry.getEnvironment(), entry.getError().orElse(null));
        }
    }

    /**
     * Stores the result for {@code environment}. A null {@code error} means the check passed.
     */
    public synchronized CheckRecordResult record(@NonNull Environment environment, String error) {
        for (int i = 0; i < entries.size(); i++) {
            CheckEntry existing = entries.get(i);
            if (existing.getEnvironment().equals(environment)) {
                String previousError = existing.getError().orElse(null);
                if (Objects.equals(previousError, error)) {
                    return CheckRecordResult.unchanged();
                }
                entries.set(i, CheckEntry.of(environment, error));
                return CheckRecordResult.changed(previousError);
            }
        }
        entries.add(CheckEntry.of(environment, error));
        return CheckRecordResult.added();
    }

    public synchronized boolean anyPassed() {
        return entries.stream().anyMatch(CheckEntry::isPassed);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized List<CheckEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized Optional<CheckEntry> resultFor(@NonNull Environment environment) {
        return entries.stream()
                .filter(entry -> entry.getEnvironment().equals(environment))
                .findFirst();
    }

    public synchronized List<Environment> passedEnvironments() {
        return entries.stream()
                .filter(CheckEntry::isPassed)
                .map(CheckEntry::getEnvironment)
                .toList();
    }

    @Override
    public synchronized String toString() {
        return "CompatibilityLedger" + entries;
    }
}
