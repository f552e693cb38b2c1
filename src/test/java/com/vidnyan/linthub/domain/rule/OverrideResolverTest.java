package com.vidnyan.linthub.domain.rule;

import com.vidnyan.linthub.domain.model.Diagnostic;
import com.vidnyan.linthub.domain.model.Linter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OverrideResolverTest {

    private static Diagnostic diag(Linter source, String path, int line, String code) {
        return Diagnostic.at(source, path, line, 1, code, code + " message");
    }

    @Test
    void resolve_ShouldDropDiagnosticSuppressedOnSameLine() {
        Diagnostic unusedImport = diag(Linter.FLAKE8, "a.py", 3, "F401");
        Diagnostic pylintUnused = diag(Linter.PYLINT, "a.py", 3, "W0611");
        Overrides overrides = new Overrides(Map.of("F401", Set.of("W0611")));

        List<Diagnostic> result = OverrideResolver.resolve(List.of(unusedImport, pylintUnused), overrides);

        assertEquals(List.of(pylintUnused), result);
    }

    @Test
    void resolve_ShouldOnlyConsultTheDiagnosticsOwnEntry() {
        Diagnostic first = diag(Linter.PYLINT, "b.py", 2, "C0114");
        Diagnostic second = diag(Linter.PYLINT, "b.py", 2, "W0611");
        Overrides overrides = new Overrides(Map.of("C0114", Set.of("W0611")));

        List<Diagnostic> result = OverrideResolver.resolve(List.of(first, second), overrides);

        // C0114 lists W0611 as its suppressor, so C0114 goes and W0611 stays
        assertEquals(List.of(second), result);
    }

    @Test
    void resolve_ShouldKeepDiagnosticsOnOtherLines() {
        Diagnostic unusedImport = diag(Linter.FLAKE8, "a.py", 3, "F401");
        Diagnostic pylintUnused = diag(Linter.PYLINT, "a.py", 4, "W0611");
        Overrides overrides = new Overrides(Map.of("F401", Set.of("W0611")));

        List<Diagnostic> result = OverrideResolver.resolve(List.of(unusedImport, pylintUnused), overrides);

        assertEquals(List.of(unusedImport, pylintUnused), result);
    }

    @Test
    void resolve_ShouldGroupLinesAcrossFiles() {
        Diagnostic inA = diag(Linter.FLAKE8, "a.py", 7, "F401");
        Diagnostic inB = diag(Linter.PYLINT, "b.py", 7, "W0611");
        Overrides overrides = new Overrides(Map.of("F401", Set.of("W0611")));

        List<Diagnostic> result = OverrideResolver.resolve(List.of(inA, inB), overrides);

        assertEquals(List.of(inB), result);
    }

    @Test
    void resolve_ShouldReturnInputWhenNoEntryMatches() {
        List<Diagnostic> input = List.of(
                diag(Linter.PYLINT, "a.py", 1, "C0116"),
                diag(Linter.FLAKE8, "a.py", 1, "E302"),
                diag(Linter.PYLINT, "a.py", 1, "C0116"));

        assertEquals(input, OverrideResolver.resolve(input, new Overrides(Map.of("F401", Set.of("W0611")))));
        assertEquals(input, OverrideResolver.resolve(input, Overrides.none()));
    }
}
