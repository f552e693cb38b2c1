package com.vidnyan.linthub.application.exception;

import com.vidnyan.linthub.domain.model.Linter;
import org.springframework.boot.ExitCodeGenerator;

/**
 * A linter exited with a code outside its accepted set.
 * Fatal for the whole run: the host process exits with the same code.
 */
public class LinterCrashedException extends RuntimeException implements ExitCodeGenerator {

    private final Linter linter;
    private final int exitCode;

    public LinterCrashedException(Linter linter, int exitCode) {
        super(linter + " exited with " + exitCode);
        this.linter = linter;
        this.exitCode = exitCode;
    }

    public Linter getLinter() {
        return linter;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
