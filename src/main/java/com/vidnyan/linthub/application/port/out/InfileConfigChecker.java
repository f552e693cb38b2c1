package com.vidnyan.linthub.application.port.out;

import com.vidnyan.linthub.domain.model.Diagnostic;

import java.util.List;
import java.util.Set;

/**
 * Port for the in-process check that reports in-file configuration the caller chose to ignore.
 */
public interface InfileConfigChecker {

    /**
     * @param filenames files to scan
     * @param ignored   option ids whose in-file configuration is disallowed
     */
    List<Diagnostic> check(List<String> filenames, Set<String> ignored);
}
