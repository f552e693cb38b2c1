package com.vidnyan.linthub.application.port.out;

import com.vidnyan.linthub.domain.config.LintConfig;
import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;

import java.util.List;

/**
 * Port for one external linter: its arguments, its exit code policy and its output format.
 * There is exactly one adapter per subprocess {@link Linter}.
 */
public interface LinterAdapter {

    Linter linter();

    /**
     * Linter-specific flags followed by the extra arguments configured for this linter.
     * Filenames are appended by the caller.
     */
    List<String> arguments(LintConfig config);

    /**
     * Whether the exit code means the linter itself failed rather than reported issues.
     */
    boolean isFatalExitCode(int exitCode);

    /**
     * Convert non-empty linter output into diagnostics whose paths are the submitted filenames.
     */
    List<Diagnostic> parse(List<String> filenames, String output);
}
