package com.ffibind.generator.checks;

import com.ffibind.generator.database.DatabaseConfig;
import com.ffibind.generator.database.ItemDatabase;
import com.ffibind.generator.model.ffi.FfiArgument;
import com.ffibind.generator.model.ffi.FfiArgumentRole;
import com.ffibind.generator.model.ffi.WrapperFunction;
import com.ffibind.generator.model.id.FfiItemId;
import com.ffibind.generator.model.path.ItemPath;
import com.ffibind.generator.model.target.Environment;
import com.ffibind.generator.model.target.PlatformTarget;
import com.ffibind.generator.model.type.NamedType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CompatibilityCheckRunner.
 */
class CompatibilityCheckRunnerTest {

    private static final PlatformTarget LINUX = PlatformTarget.builder()
            .arch(PlatformTarget.Arch.X86_64)
            .os(PlatformTarget.OperatingSystem.LINUX)
            .pointerWidth(PlatformTarget.PointerWidth.P64)
            .build();
    private static final Environment ENV_X = Environment.of(LINUX, "5.15");
    private static final Environment ENV_Y = Environment.of(LINUX, "6.2");

    private final DatabaseConfig config = DatabaseConfig.builder()
            .packageName("pkg")
            .checkThreads(2)
            .build();

    private ItemDatabase database;
    private FfiItemId ffiId;

    @BeforeEach
    void setUp() {
        database = ItemDatabase.create(config);
        database.registerEnvironment(ENV_X);
        database.registerEnvironment(ENV_Y);
        WrapperFunction wrapper = WrapperFunction.builder()
                .path(ItemPath.of("pkg_ffi", "widget_show"))
                .nativePath(ItemPath.of("gui", "Widget", "show"))
                .argument(FfiArgument.of("this_ptr", NamedType.builtIn("usize"), FfiArgumentRole.RECEIVER))
                .build();
        database.addFfiItem(wrapper);
        ffiId = database.findFfiItemId(wrapper).orElseThrow();
    }

    @Test
    void testRecordsResultPerEnvironment() {
        WrapperCheck check = (item, environment) ->
                environment.equals(ENV_Y) ? Optional.of("link error") : Optional.empty();

        CheckRunSummary summary = new CompatibilityCheckRunner(database, check, config).runAll();

        assertThat(summary.getItemsChecked()).isEqualTo(1);
        assertThat(summary.getAdded()).isEqualTo(2);
        assertThat(summary.hasRegressions()).isFalse();
        CompatibilityLedger ledger = database.ffiItem(ffiId).getChecks();
        assertThat(ledger.entries()).containsExactly(CheckEntry.of(ENV_X, null), CheckEntry.of(ENV_Y, "link error"));
        assertThat(ledger.anyPassed()).isTrue();
    }

    @Test
    void testRerunReportsUnchangedAndRegressions() {
        CompatibilityCheckRunner passing = new CompatibilityCheckRunner(database,
                (item, environment) -> Optional.empty(), config);
        passing.runAll();

        CheckRunSummary unchanged = passing.runAll();
        assertThat(unchanged.getUnchanged()).isEqualTo(2);
        assertThat(unchanged.getChanged()).isZero();

        CheckRunSummary regressed = new CompatibilityCheckRunner(database,
                (item, environment) -> environment.equals(ENV_X) ? Optional.of("crash") : Optional.empty(), config)
                .runAll();

        assertThat(regressed.getChanged()).isEqualTo(1);
        assertThat(regressed.getRegressions())
                .containsExactly(CheckRunSummary.Regression.of(ffiId, ENV_X, "crash"));
    }

    @Test
    void testExceptionFromCheckIsRecordedAsFailure() {
        WrapperCheck check = (item, environment) -> {
            throw new IOException("compiler not found");
        };

        CheckRunSummary summary = new CompatibilityCheckRunner(database, check, config).runAll();

        assertThat(summary.getAdded()).isEqualTo(2);
        assertThat(database.ffiItem(ffiId).getChecks().anyPassed()).isFalse();
        assertThat(database.ffiItem(ffiId).getChecks().resultFor(ENV_X).flatMap(CheckEntry::getError))
                .contains("compiler not found");
    }

    @Test
    void testChecksOfOneItemRunForEveryEnvironment() {
        AtomicInteger calls = new AtomicInteger();

        new CompatibilityCheckRunner(database, (item, environment) -> {
            calls.incrementAndGet();
            return Optional.empty();
        }, config).runAll();

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void testNoEnvironmentsMeansNothingToCheck() {
        ItemDatabase empty = ItemDatabase.create(config);

        CheckRunSummary summary = new CompatibilityCheckRunner(empty,
                (item, environment) -> Optional.empty(), config).runAll();

        assertThat(summary).isEqualTo(CheckRunSummary.empty());
    }

    @Test
    void testInvalidThreadCountIsRejected() {
        DatabaseConfig invalid = config.toBuilder().checkThreads(0).build();

        assertThatThrownBy(() -> new CompatibilityCheckRunner(database, (item, environment) -> Optional.empty(), invalid))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
