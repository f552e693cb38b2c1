package com.vidnyan.linthub.application.port.in;

import com.vidnyan.linthub.application.exception.LinterTimeoutException;
import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.model.Diagnostic;

import java.util.List;

/**
 * Primary use case: lint groups of files and return one ordered diagnostic list.
 */
public interface LintUseCase {

    /**
     * Lint one unit.
     * @throws LinterTimeoutException when a linter exceeds its timeout
     */
    List<Diagnostic> aggregate(List<String> filenames, LintConfig config);

    /**
     * Lint independent units and concatenate their results in unit order.
     * A timeout in any unit propagates.
     */
    List<Diagnostic> aggregateMany(List<LintUnit> units);

    /**
     * Lint independent units, reporting timeouts per unit instead of failing the whole batch.
     */
    List<UnitOutcome> lintUnits(List<LintUnit> units);

    /**
     * Files linted together under one config.
     */
    record LintUnit(List<String> filenames, LintConfig config) {
        public LintUnit {
            filenames = List.copyOf(filenames);
        }

        public static LintUnit of(LintConfig config, String... filenames) {
            return new LintUnit(List.of(filenames), config);
        }
    }

    /**
     * Result of one unit: diagnostics, or the timeout that aborted it.
     */
    record UnitOutcome(LintUnit unit, List<Diagnostic> diagnostics, LinterTimeoutException timeout) {

        public static UnitOutcome completed(LintUnit unit, List<Diagnostic> diagnostics) {
            return new UnitOutcome(unit, List.copyOf(diagnostics), null);
        }

        public static UnitOutcome timedOut(LintUnit unit, LinterTimeoutException timeout) {
            return new UnitOutcome(unit, List.of(), timeout);
        }

        public boolean isTimedOut() {
            return timeout != null;
        }
    }
}
