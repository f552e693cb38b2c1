package com.vidnyan.linthub.domain.model;

/**
 * Producers of diagnostics.
 * FLAKE8 and PYLINT run as external processes, LINTHUB diagnostics come from in-process checks.
 */
public enum Linter {
    LINTHUB("linthub"),
    FLAKE8("flake8"),
    PYLINT("pylint");

    private final String moduleName;

    Linter(String moduleName) {
        this.moduleName = moduleName;
    }

    /**
     * Name passed to {@code <interpreter> -m}.
     */
    public String moduleName() {
        return moduleName;
    }

    @Override
    public String toString() {
        return moduleName;
    }
}
