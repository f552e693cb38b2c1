package com.vidnyan.linthub.application.service;

import com.vidnyan.linthub.LinthubProperties;
import com.vidnyan.linthub.application.exception.LinterCrashedException;
import com.vidnyan.linthub.application.exception.LinterTimeoutException;
import com.vidnyan.linthub.application.port.out.LinterAdapter;
import com.vidnyan.linthub.application.port.out.ProcessRunner;
import com.vidnyan.linthub.application.port.out.ProcessRunner.ProcessResult;
import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one external linter end to end: command line, process, exit code policy, output parsing.
 */
@Slf4j
@Component
public class LinterInvoker {

    private final ProcessRunner processRunner;
    private final LinthubProperties properties;
    private final Map<Linter, LinterAdapter> adapters = new EnumMap<>(Linter.class);

    public LinterInvoker(ProcessRunner processRunner, LinthubProperties properties, List<LinterAdapter> adapters) {
        this.processRunner = processRunner;
        this.properties = properties;
        for (LinterAdapter adapter : adapters) {
            if (this.adapters.put(adapter.linter(), adapter) != null) {
                throw new IllegalStateException("Duplicate adapter for " + adapter.linter());
            }
        }
    }

    /**
     * Lint the files with one linter.
     *
     * @throws LinterTimeoutException when the process is killed on timeout
     * @throws LinterCrashedException when the linter exits with a code outside its accepted set
     */
    public List<Diagnostic> lint(Linter linter, List<String> filenames, LintConfig config) {
        LinterAdapter adapter = adapters.get(linter);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for " + linter);
        }

        List<String> command = command(adapter, filenames, config);
        log.debug("Running {}", command);
        ProcessResult result = processRunner.run(command, properties.getTimeout());

        if (result.isKilledByTimeout()) {
            log.error("linthub: {} was likely killed by timeout", linter);
            throw new LinterTimeoutException(linter);
        }

        if (adapter.isFatalExitCode(result.exitCode())) {
            log.error("linthub: {} exited with {}", linter, result.exitCode());
            throw new LinterCrashedException(linter, result.exitCode());
        }

        if (result.stdout().isBlank()) {
            return List.of();
        }

        List<Diagnostic> diagnostics = adapter.parse(filenames, result.stdout());
        log.debug("{} reported {} diagnostic(s)", linter, diagnostics.size());
        return diagnostics;
    }

    /**
     * {@code <interpreter> -m <linter> <linter args> <config args> <filenames>}.
     */
    List<String> command(LinterAdapter adapter, List<String> filenames, LintConfig config) {
        List<String> command = new ArrayList<>();
        command.add(properties.getInterpreter());
        command.add("-m");
        command.add(adapter.linter().moduleName());
        command.addAll(adapter.arguments(config));
        command.addAll(filenames);
        return command;
    }
}
