package com.vidnyan.linthub.domain.rule;

import com.vidnyan.linthub.domain.model.Diagnostic;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops diagnostics whose code is suppressed by another code reported on the same line.
 * Lines are compared by number only, across all files of the input list.
 */
public final class OverrideResolver {

    private OverrideResolver() {
    }

    public static List<Diagnostic> resolve(List<Diagnostic> diagnostics, Overrides overrides) {
        Map<Integer, Set<String>> codesOnLines = new HashMap<>();
        for (Diagnostic diagnostic : diagnostics) {
            codesOnLines.computeIfAbsent(diagnostic.line(), line -> new HashSet<>())
                    .add(diagnostic.code());
        }

        return diagnostics.stream()
                .filter(d -> Collections.disjoint(
                        overrides.suppressorsOf(d.code()), codesOnLines.get(d.line())))
                .toList();
    }
}
