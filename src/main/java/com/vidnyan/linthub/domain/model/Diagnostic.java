package com.vidnyan.linthub.domain.model;

import java.util.Objects;

/**
 * A single normalized issue reported by one of the linters.
 * Immutable value object; pipeline stages that change the message produce a copy.
 *
 * @param endLine   null when the linter does not report a range end
 * @param endColumn null when the linter does not report a range end
 * @param symbol    human-readable name of the code, null when unknown
 */
public record Diagnostic(
    Linter source,
    String path,
    int line,
    int column,
    String code,
    String message,
    Integer endLine,
    Integer endColumn,
    String symbol
) {

    public Diagnostic {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Create a diagnostic without range end or symbol.
     */
    public static Diagnostic at(Linter source, String path, int line, int column, String code, String message) {
        return new Diagnostic(source, path, line, column, code, message, null, null, null);
    }

    /**
     * Copy with a replaced message; every other field is kept.
     */
    public Diagnostic withMessage(String newMessage) {
        return new Diagnostic(source, path, line, column, code, newMessage, endLine, endColumn, symbol);
    }

    /**
     * Format as {@code path:line:column: code message}.
     */
    public String format() {
        return path + ":" + line + ":" + column + ": " + code + " " + message;
    }
}
