package com.vidnyan.linthub.adapter.in.cli;

import com.vidnyan.linthub.LinthubProperties;
import com.vidnyan.linthub.application.exception.LinterCrashedException;
import com.vidnyan.linthub.application.port.in.LintUseCase;
import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.model.Diagnostic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * CLI runner: lints the files given as arguments (or {@code linthub.files}) as one unit
 * and prints one diagnostic per line to stdout.
 */
@Slf4j
@Component
public class LintCliRunner implements CommandLineRunner {

    private final LintUseCase lintUseCase;
    private final LinthubProperties properties;
    private final LintConfig defaultLintConfig;
    private final ConfigurableApplicationContext context;
    private final PrintStream out;
    private final IntConsumer exit;

    @Autowired
    public LintCliRunner(LintUseCase lintUseCase, LinthubProperties properties,
                         LintConfig defaultLintConfig, ConfigurableApplicationContext context) {
        this(lintUseCase, properties, defaultLintConfig, context, System.out, System::exit);
    }

    LintCliRunner(LintUseCase lintUseCase, LinthubProperties properties, LintConfig defaultLintConfig,
                  ConfigurableApplicationContext context, PrintStream out, IntConsumer exit) {
        this.lintUseCase = lintUseCase;
        this.properties = properties;
        this.defaultLintConfig = defaultLintConfig;
        this.context = context;
        this.out = out;
        this.exit = exit;
    }

    @Override
    public void run(String... args) {
        List<String> filenames = filenames(args);
        if (filenames.isEmpty()) {
            log.info("No files to lint. Pass them as arguments or set linthub.files.");
            return;
        }

        List<Diagnostic> diagnostics;
        try {
            diagnostics = lintUseCase.aggregate(filenames, defaultLintConfig);
        } catch (LinterCrashedException e) {
            // a crashed linter invalidates the whole run
            exit.accept(exitCode(e));
            return;
        }

        diagnostics.forEach(d -> out.println(d.format()));
        log.info("{} diagnostic(s) in {} file(s)", diagnostics.size(), filenames.size());
    }

    /**
     * Close the application context and return the crashed linter's exit code.
     */
    int exitCode(LinterCrashedException crash) {
        return SpringApplication.exit(context, crash);
    }

    private List<String> filenames(String[] args) {
        List<String> fromArgs = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .toList();
        return fromArgs.isEmpty() ? List.copyOf(properties.getFiles()) : fromArgs;
    }
}
