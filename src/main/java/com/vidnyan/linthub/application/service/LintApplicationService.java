package com.vidnyan.linthub.application.service;

import com.vidnyan.linthub.application.exception.LinterTimeoutException;
import com.vidnyan.linthub.application.port.in.LintUseCase;
import com.vidnyan.linthub.application.port.out.InfileConfigChecker;
import com.vidnyan.linthub.application.port.out.OverrideCatalog;
import com.vidnyan.linthub.application.port.out.TweakCatalog;
import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.config.Option;
import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;
import com.vidnyan.linthub.domain.rule.DiagnosticOrder;
import com.vidnyan.linthub.domain.rule.OverrideResolver;
import com.vidnyan.linthub.domain.rule.TweakEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Main application service: runs the linters of a unit, merges their findings,
 * resolves overrides, applies tweaks and sorts the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LintApplicationService implements LintUseCase {

    private final LinterInvoker linterInvoker;
    private final InfileConfigChecker infileConfigChecker;
    private final OverrideCatalog overrideCatalog;
    private final TweakCatalog tweakCatalog;
    private final ExecutorService lintExecutor;

    @Override
    public List<Diagnostic> aggregate(List<String> filenames, LintConfig config) {
        Instant startTime = Instant.now();
        log.debug("Linting {} file(s)", filenames.size());

        List<Diagnostic> merged = new ArrayList<>();
        merged.addAll(lintInfileConfig(filenames, config));
        if (!config.getBoolean(Option.NO_FLAKE8)) {
            merged.addAll(linterInvoker.lint(Linter.FLAKE8, filenames, config));
        }
        merged.addAll(linterInvoker.lint(Linter.PYLINT, filenames, config));

        List<Diagnostic> result = OverrideResolver.resolve(merged, overrideCatalog.get());
        result = TweakEngine.apply(result, tweakCatalog.get(), config);
        result = DiagnosticOrder.sort(filenames, result);

        log.debug("Lint complete: {} of {} diagnostic(s) kept in {}ms",
                result.size(), merged.size(), Duration.between(startTime, Instant.now()).toMillis());
        return result;
    }

    @Override
    public List<Diagnostic> aggregateMany(List<LintUnit> units) {
        return runAll(units, unit -> aggregate(unit.filenames(), unit.config())).stream()
                .flatMap(List::stream)
                .toList();
    }

    @Override
    public List<UnitOutcome> lintUnits(List<LintUnit> units) {
        return runAll(units, unit -> {
            try {
                return UnitOutcome.completed(unit, aggregate(unit.filenames(), unit.config()));
            } catch (LinterTimeoutException e) {
                log.warn("Unit {} aborted: {}", unit.filenames(), e.getMessage());
                return UnitOutcome.timedOut(unit, e);
            }
        });
    }

    private List<Diagnostic> lintInfileConfig(List<String> filenames, LintConfig config) {
        Set<String> ignored = config.getSet(Option.IGNORE_INFILE_CONFIG_FOR);
        if (ignored.isEmpty()) {
            return List.of();
        }
        return infileConfigChecker.check(filenames, ignored);
    }

    /**
     * Run units on the executor and return their results in unit order.
     * Results are taken as units finish, so the first failure cancels the units still
     * running and is rethrown unwrapped without waiting for earlier units.
     */
    private <T> List<T> runAll(List<LintUnit> units, Function<LintUnit, T> task) {
        CompletionService<T> completion = new ExecutorCompletionService<>(lintExecutor);
        Map<Future<T>, Integer> positions = new HashMap<>();
        for (int i = 0; i < units.size(); i++) {
            LintUnit unit = units.get(i);
            positions.put(completion.submit(() -> task.apply(unit)), i);
        }

        List<T> results = new ArrayList<>(Collections.nCopies(units.size(), null));
        try {
            for (int done = 0; done < units.size(); done++) {
                Future<T> finished = completion.take();
                results.set(positions.get(finished), finished.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            positions.keySet().forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while linting", e);
        } catch (ExecutionException e) {
            positions.keySet().forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw new CompletionException(e.getCause());
        }
        return results;
    }
}
