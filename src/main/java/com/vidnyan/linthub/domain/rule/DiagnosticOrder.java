package com.vidnyan.linthub.domain.rule;

import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.ProperPath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Final ordering: files in the order the caller listed them, then line, then column.
 * The sort is stable, so equal positions keep their merge order.
 */
public final class DiagnosticOrder {

    private DiagnosticOrder() {
    }

    public static List<Diagnostic> sort(List<String> filenames, List<Diagnostic> diagnostics) {
        Map<String, Integer> indices = new HashMap<>();
        for (int i = 0; i < filenames.size(); i++) {
            indices.putIfAbsent(ProperPath.of(filenames.get(i)), i);
        }

        Comparator<Diagnostic> order = Comparator
                .<Diagnostic>comparingInt(d -> indexOf(indices, d))
                .thenComparingInt(Diagnostic::line)
                .thenComparingInt(Diagnostic::column);

        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(order);
        return sorted;
    }

    private static int indexOf(Map<String, Integer> indices, Diagnostic diagnostic) {
        Integer index = indices.get(diagnostic.path());
        if (index == null) {
            throw new IllegalStateException("Diagnostic path " + diagnostic.path() + " is not a linted file");
        }
        return index;
    }
}
