package com.vidnyan.linthub.application.exception;

import com.vidnyan.linthub.domain.model.Linter;

/**
 * A linter process was killed because it exceeded its timeout.
 * Aborts the unit it belongs to, not unrelated units.
 */
public class LinterTimeoutException extends RuntimeException {

    private final Linter linter;

    public LinterTimeoutException(Linter linter) {
        super("Timeout from " + linter);
        this.linter = linter;
    }

    public Linter getLinter() {
        return linter;
    }
}
