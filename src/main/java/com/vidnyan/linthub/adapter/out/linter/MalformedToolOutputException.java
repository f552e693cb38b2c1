package com.vidnyan.linthub.adapter.out.linter;

import com.vidnyan.linthub.domain.model.Linter;

/**
 * Linter output that does not have the shape the adapter expects.
 * Aborts processing of that linter's output.
 */
public class MalformedToolOutputException extends IllegalStateException {

    public MalformedToolOutputException(Linter linter, String detail) {
        super("Malformed " + linter + " output: " + detail);
    }

    public MalformedToolOutputException(Linter linter, String detail, Throwable cause) {
        super("Malformed " + linter + " output: " + detail, cause);
    }
}
